package io.tiller.core.slot;

import java.util.List;
import java.util.Objects;

/// Question set returned to the user when clarification suspends.
///
/// @param intro optional lead-in line, never null (may be empty)
/// @param questions one question per missing field, never null
/// @param closing optional closing line, never null (may be empty)
public record FollowUpQuestions(String intro, List<FollowUpQuestion> questions, String closing) {

    public FollowUpQuestions {
        intro = intro != null ? intro : "";
        Objects.requireNonNull(questions, "questions must not be null");
        questions = List.copyOf(questions);
        closing = closing != null ? closing : "";
    }

    public static FollowUpQuestions of(List<FollowUpQuestion> questions) {
        return new FollowUpQuestions("", questions, "");
    }
}
