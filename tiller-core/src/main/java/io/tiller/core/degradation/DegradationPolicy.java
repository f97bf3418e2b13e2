package io.tiller.core.degradation;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Logger;

/// Fail-open / fail-closed decision per integration point.
///
/// Each component has a default mode. An override source is consulted on every
/// call so that operators can flip a component without a restart; unrecognised
/// override values are ignored.
///
/// ### Default policy table
/// | Component | Mode |
/// |---|---|
/// | `clarifier` | fail open |
/// | `suspend_store` | fail closed |
/// | `source_usage_log` | fail open |
/// | `consent_ledger` | fail closed |
///
/// Unknown components default to fail open.
///
/// @implNote Thread-safe if the override source is.
public final class DegradationPolicy {

    public static final String CLARIFIER = "clarifier";
    public static final String SUSPEND_STORE = "suspend_store";
    public static final String SOURCE_USAGE_LOG = "source_usage_log";
    public static final String CONSENT_LEDGER = "consent_ledger";

    private static final Logger logger = Logger.getLogger(DegradationPolicy.class.getName());

    private final Map<String, DegradationMode> defaults;
    private final Function<String, Optional<String>> overrides;

    /// Creates a policy.
    ///
    /// @param defaults per-component default modes, not null
    /// @param overrides runtime override lookup by component name, not null
    public DegradationPolicy(
            Map<String, DegradationMode> defaults,
            Function<String, Optional<String>> overrides) {
        this.defaults = Map.copyOf(Objects.requireNonNull(defaults, "defaults must not be null"));
        this.overrides = Objects.requireNonNull(overrides, "overrides must not be null");
    }

    /// Returns the built-in policy table without overrides.
    public static DegradationPolicy defaults() {
        return withOverrides(component -> Optional.empty());
    }

    /// Returns the built-in policy table with a runtime override source.
    ///
    /// @param overrides override lookup by component name, not null
    /// @return new policy, never null
    public static DegradationPolicy withOverrides(Function<String, Optional<String>> overrides) {
        Map<String, DegradationMode> table = new LinkedHashMap<>();
        table.put(CLARIFIER, DegradationMode.FAIL_OPEN);
        table.put(SUSPEND_STORE, DegradationMode.FAIL_CLOSED);
        table.put(SOURCE_USAGE_LOG, DegradationMode.FAIL_OPEN);
        table.put(CONSENT_LEDGER, DegradationMode.FAIL_CLOSED);
        return new DegradationPolicy(table, overrides);
    }

    /// Resolves the effective mode for a component.
    ///
    /// @param component component name, not null
    /// @return effective mode, never null
    public DegradationMode modeFor(String component) {
        Objects.requireNonNull(component, "component must not be null");
        Optional<String> raw = overrides.apply(component);
        if (raw.isPresent()) {
            Optional<DegradationMode> parsed = DegradationMode.parse(raw.get());
            if (parsed.isPresent()) {
                return parsed.get();
            }
            logger.warning("Ignoring unrecognised degradation override for " + component);
        }
        return defaults.getOrDefault(component, DegradationMode.FAIL_OPEN);
    }

    public boolean isFailOpen(String component) {
        return modeFor(component) == DegradationMode.FAIL_OPEN;
    }
}
