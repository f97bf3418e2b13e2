package io.tiller.serialization.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.slot.FollowUpQuestions;
import io.tiller.core.slot.ModelResponseException;
import io.tiller.core.slot.ModelResponseParser;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link ModelResponseParser}.
///
/// Strips markdown code fences, then falls back to the outermost `{...}` or `[...]`
/// bounds when the model wrapped its JSON in prose. Question entries accept either
/// `field`/`question` or `fieldName`/`questionText` keys; entries without a field or
/// text are dropped so the clarifier can fill them with fallback questions.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
public class JacksonModelResponseParser implements ModelResponseParser {

    private final ObjectMapper objectMapper;

    public JacksonModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public Map<String, Object> parseFields(String content) throws ModelResponseException {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root = readTree(extractJson(content, '{', '}'));
        if (!root.isObject()) {
            throw new ModelResponseException("Expected a JSON object of field values");
        }

        Map<String, Object> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            values.put(entry.getKey(), toValue(entry.getValue()));
        }
        return values;
    }

    @Override
    public FollowUpQuestions parseQuestions(String content) throws ModelResponseException {
        Objects.requireNonNull(content, "content must not be null");
        int brace = content.indexOf('{');
        int bracket = content.indexOf('[');
        boolean array = bracket >= 0 && (brace < 0 || bracket < brace);
        JsonNode root =
                readTree(array ? extractJson(content, '[', ']') : extractJson(content, '{', '}'));

        if (root.isArray()) {
            return FollowUpQuestions.of(questions(root));
        }
        if (root.isObject() && root.path("questions").isArray()) {
            return new FollowUpQuestions(
                    root.path("intro").asText(""),
                    questions(root.get("questions")),
                    root.path("closing").asText(""));
        }
        throw new ModelResponseException("Expected a question array or an object with 'questions'");
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    private JsonNode readTree(String json) throws ModelResponseException {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ModelResponseException("Failed to parse model JSON: " + e.getMessage(), e);
        }
    }

    private Object toValue(JsonNode node) throws ModelResponseException {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, Object.class);
        } catch (JsonProcessingException e) {
            throw new ModelResponseException("Unreadable field value: " + e.getMessage(), e);
        }
    }

    private static List<FollowUpQuestion> questions(JsonNode array) {
        List<FollowUpQuestion> questions = new ArrayList<>();
        for (JsonNode q : array) {
            String field = text(q, "field", "fieldName");
            String text = text(q, "question", "questionText");
            if (field != null && text != null) {
                questions.add(new FollowUpQuestion(field, text));
            }
        }
        return questions;
    }

    private static String text(JsonNode node, String key, String alternative) {
        JsonNode value = node.hasNonNull(key) ? node.get(key) : node.get(alternative);
        if (value == null || value.isNull() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    /// Extracts the JSON content from a model response, stripping markdown fences.
    ///
    /// @param content raw response string, not null
    /// @param open opening bracket to fall back on
    /// @param close closing bracket to fall back on
    /// @return cleaned JSON string ready for parsing
    static String extractJson(String content, char open, char close) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        String trimmed = content.trim();
        if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
            return trimmed;
        }
        int first = content.indexOf(open);
        int last = content.lastIndexOf(close);
        if (first >= 0 && last > first) {
            return content.substring(first, last + 1);
        }
        return trimmed;
    }
}
