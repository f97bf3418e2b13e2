package io.tiller.core.slot;

import java.util.Locale;
import java.util.Objects;

/// A question asking the user for one missing field.
///
/// @param fieldName the field the answer fills, not null
/// @param questionText text shown to the user, not null
public record FollowUpQuestion(String fieldName, String questionText) {

    public FollowUpQuestion {
        Objects.requireNonNull(fieldName, "fieldName must not be null");
        Objects.requireNonNull(questionText, "questionText must not be null");
    }

    /// Builds the fallback question from the field name alone.
    ///
    /// {@snippet :
    /// FollowUpQuestion.fallback("check_in").questionText(); // "What is the check in?"
    /// }
    ///
    /// @param fieldName field name, not null
    /// @return question derived from the field name, never null
    public static FollowUpQuestion fallback(String fieldName) {
        String readable = fieldName.replace('_', ' ').toLowerCase(Locale.ROOT);
        return new FollowUpQuestion(fieldName, "What is the " + readable + "?");
    }
}
