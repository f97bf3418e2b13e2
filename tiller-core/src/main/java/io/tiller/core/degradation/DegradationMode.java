package io.tiller.core.degradation;

import java.util.Locale;
import java.util.Optional;

/// Behaviour of a component when one of its dependencies fails.
public enum DegradationMode {
    /// Continue with reduced information.
    FAIL_OPEN,
    /// Surface the failure to the caller.
    FAIL_CLOSED;

    /// Parses `fail_open` / `fail_closed` (case-insensitive).
    ///
    /// @param raw configured value, may be null
    /// @return the mode, or empty if the value is not recognised
    public static Optional<DegradationMode> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "fail_open" -> Optional.of(FAIL_OPEN);
            case "fail_closed" -> Optional.of(FAIL_CLOSED);
            default -> Optional.empty();
        };
    }
}
