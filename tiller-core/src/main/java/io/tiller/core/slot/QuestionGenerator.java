package io.tiller.core.slot;

import java.util.List;

/// Produces human-friendly follow-up questions for missing fields.
///
/// Generators may omit fields or fail outright; {@link SlotClarifier} fills every
/// gap with {@link FollowUpQuestion#fallback(String)}.
@FunctionalInterface
public interface QuestionGenerator {

    /// Generates questions for the missing fields of a request.
    ///
    /// @param request missing fields and context, not null
    /// @return generated question set, never null
    /// @throws RuntimeException if generation fails
    FollowUpQuestions generate(QuestionRequest request);

    /// Returns a generator that only produces fallback questions.
    ///
    /// @return field-name based generator, never null
    static QuestionGenerator fallback() {
        return request -> {
            List<FollowUpQuestion> questions =
                    request.missingFields().stream().map(FollowUpQuestion::fallback).toList();
            return FollowUpQuestions.of(questions);
        };
    }
}
