package io.tiller.server.config;

import io.tiller.core.router.FeatureFlags;
import java.util.Map;
import java.util.Objects;
import org.eclipse.microprofile.config.Config;

/// {@link FeatureFlags} read from MicroProfile Config under `tiller.flags.<FLAG>`.
///
/// The configuration is consulted on every call, so a config source that changes
/// at runtime switches sources without a restart. Flags absent from the
/// configuration fall back to the supplied defaults, then to disabled.
///
/// @implNote Thread-safe.
public class ConfigFeatureFlags implements FeatureFlags {

    static final String PREFIX = "tiller.flags.";

    private final Config config;
    private final Map<String, Boolean> defaults;

    public ConfigFeatureFlags(Config config, Map<String, Boolean> defaults) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.defaults = Map.copyOf(Objects.requireNonNull(defaults, "defaults must not be null"));
    }

    @Override
    public boolean isEnabled(String flag) {
        Objects.requireNonNull(flag, "flag must not be null");
        return config.getOptionalValue(PREFIX + flag, Boolean.class)
                .orElseGet(() -> defaults.getOrDefault(flag, false));
    }
}
