package io.tiller.core.slot;

import java.util.List;
import java.util.Map;

/// Parses structured language-model output for the clarifier.
///
/// Keeps `tiller-core` free of a JSON library. The Jackson implementation lives in
/// `tiller-serialization` as `JacksonModelResponseParser`.
///
/// ### Supported shapes (JSON)
///
/// **Extracted fields**: an object mapping field names to values or `null`.
/// ```json
/// {"destination": "Lisbon", "check_in": null}
/// ```
///
/// **Questions**: an array, or an object carrying an `intro`, a `questions` array
/// and a `closing` line.
/// ```json
/// {"intro": "Almost there.", "questions": [{"field": "check_in", "question": "When do you arrive?"}]}
/// ```
///
/// Content may be wrapped in markdown code fences; implementations strip them.
public interface ModelResponseParser {

    /// Parses extracted field values.
    ///
    /// @param content raw model response, not null
    /// @return values by field name; values may be null, never null
    /// @throws ModelResponseException if the content is not a JSON object
    Map<String, Object> parseFields(String content) throws ModelResponseException;

    /// Parses generated follow-up questions.
    ///
    /// @param content raw model response, not null
    /// @return questions, never null, may be empty
    /// @throws ModelResponseException if the content has neither supported shape
    FollowUpQuestions parseQuestions(String content) throws ModelResponseException;
}
