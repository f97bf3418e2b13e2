package io.tiller.core.router;

import java.util.Objects;

/// Prompt shown to the user when a gated tier needs consent.
///
/// @param tier tier waiting for consent
/// @param type consent being asked for, not null
/// @param message user-facing text, not null
public record ConsentPrompt(int tier, ConsentType type, String message) {

    public ConsentPrompt {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }

    public static ConsentPrompt of(int tier, ConsentType type) {
        return new ConsentPrompt(tier, type, type.message());
    }
}
