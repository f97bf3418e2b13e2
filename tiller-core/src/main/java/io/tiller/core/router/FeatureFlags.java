package io.tiller.core.router;

import java.util.Map;
import java.util.Objects;

/// Resolves named feature flags that switch individual sources on or off.
@FunctionalInterface
public interface FeatureFlags {

    /// Returns whether a flag is enabled.
    ///
    /// @param flag flag name, not null
    /// @return true if enabled
    boolean isEnabled(String flag);

    static FeatureFlags allEnabled() {
        return flag -> true;
    }

    /// Creates flags from a fixed map; unlisted flags are disabled.
    ///
    /// @param flags flag values, not null
    /// @return feature flags, never null
    static FeatureFlags of(Map<String, Boolean> flags) {
        Map<String, Boolean> copy = Map.copyOf(Objects.requireNonNull(flags, "flags must not be null"));
        return flag -> copy.getOrDefault(flag, false);
    }
}
