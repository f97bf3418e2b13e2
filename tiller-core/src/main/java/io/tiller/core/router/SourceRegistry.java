package io.tiller.core.router;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/// Name-keyed registry of {@link SourceDefinition}s.
///
/// @implNote Thread-safe.
public final class SourceRegistry {

    private final Map<String, SourceDefinition> sources = new ConcurrentHashMap<>();

    public SourceRegistry() {}

    public SourceRegistry(List<SourceDefinition> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    public void register(SourceDefinition source) {
        Objects.requireNonNull(source, "source must not be null");
        sources.put(source.name(), source);
    }

    public Optional<SourceDefinition> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(sources.get(name));
    }

    public List<SourceDefinition> all() {
        return List.copyOf(sources.values());
    }

    public int size() {
        return sources.size();
    }
}
