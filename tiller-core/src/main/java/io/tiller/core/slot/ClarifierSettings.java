package io.tiller.core.slot;

import java.util.Objects;
import java.util.Set;

/// Tunables of {@link SlotClarifier}.
///
/// @param historyWindow number of prior user messages offered to extraction, >= 0
/// @param skipIntents intents that never need clarification, never null
public record ClarifierSettings(int historyWindow, Set<String> skipIntents) {

    public static final int DEFAULT_HISTORY_WINDOW = 5;

    public ClarifierSettings {
        if (historyWindow < 0) {
            throw new IllegalArgumentException("historyWindow must be >= 0");
        }
        Objects.requireNonNull(skipIntents, "skipIntents must not be null");
        skipIntents = Set.copyOf(skipIntents);
    }

    /// Returns the defaults: five messages of history, skipping `intro` and `unclear`.
    public static ClarifierSettings defaults() {
        return new ClarifierSettings(DEFAULT_HISTORY_WINDOW, Set.of("intro", "unclear"));
    }
}
