package io.tiller.core.execution;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Capability name to {@link CapabilityHandler} lookup.
///
/// @implNote Thread-safe.
public class CapabilityHandlerRegistry {

    private final Map<String, CapabilityHandler> handlers = new ConcurrentHashMap<>();

    public void register(String capability, CapabilityHandler handler) {
        if (capability == null || capability.isBlank()) {
            throw new IllegalArgumentException("capability cannot be null or blank");
        }
        handlers.put(capability, Objects.requireNonNull(handler, "handler cannot be null"));
    }

    public Optional<CapabilityHandler> get(String capability) {
        return Optional.ofNullable(handlers.get(capability));
    }

    public boolean contains(String capability) {
        return handlers.containsKey(capability);
    }
}
