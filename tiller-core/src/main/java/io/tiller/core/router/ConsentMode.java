package io.tiller.core.router;

import java.util.Locale;

/// How the two consent flags combine to unlock a gated tier.
public enum ConsentMode {
    /// Either a standing opt-in or a per-query confirmation is enough.
    EITHER,
    /// Both a standing opt-in and a per-query confirmation are needed.
    BOTH;

    public static ConsentMode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EITHER;
        }
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
