package io.tiller.core.router;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/// An external data source the router can fetch from.
///
/// @param name unique source name, not null
/// @param provider provider key passed to the fetcher, not null
/// @param costCents cost per successful call in cents, >= 0
/// @param timeout per-call timeout, positive
/// @param requiresConsent whether calling the source needs consent in any tier it is routed to
/// @param featureFlag flag that must be enabled for the source to be used, may be null
public record SourceDefinition(
        String name,
        String provider,
        int costCents,
        Duration timeout,
        boolean requiresConsent,
        String featureFlag) {

    public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5000);

    public SourceDefinition {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        provider = provider != null ? provider : name;
        if (costCents < 0) {
            throw new IllegalArgumentException("costCents must be >= 0");
        }
        timeout = timeout != null ? timeout : DEFAULT_TIMEOUT;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    /// Creates an ungated, unflagged source with the default timeout.
    ///
    /// @param name source name, not null
    /// @param provider provider key, not null
    /// @param costCents cost per call in cents
    /// @return new source definition, never null
    public static SourceDefinition of(String name, String provider, int costCents) {
        return new SourceDefinition(name, provider, costCents, DEFAULT_TIMEOUT, false, null);
    }

    public Optional<String> flag() {
        return Optional.ofNullable(featureFlag);
    }
}
