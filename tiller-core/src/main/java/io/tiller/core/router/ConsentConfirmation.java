package io.tiller.core.router;

import java.util.Locale;
import java.util.Set;

/// Recognizes a user's reply to a consent prompt.
public final class ConsentConfirmation {

    /// Action id sent by clients when the user taps the confirmation button.
    public static final String CONFIRM_ACTION = "consent_confirm";

    private static final Set<String> CONFIRMING_REPLIES =
            Set.of("yes", "search deeper", "continue", "ok", "proceed", "go ahead");

    private ConsentConfirmation() {}

    /// Returns whether a turn confirms a pending consent prompt.
    ///
    /// @param action client action id, may be null
    /// @param text user message, may be null
    /// @return true for the confirm action or an affirmative reply
    public static boolean isConfirmation(String action, String text) {
        if (CONFIRM_ACTION.equals(action)) {
            return true;
        }
        if (text == null) {
            return false;
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        return CONFIRMING_REPLIES.contains(normalized) || normalized.startsWith("yes");
    }
}
