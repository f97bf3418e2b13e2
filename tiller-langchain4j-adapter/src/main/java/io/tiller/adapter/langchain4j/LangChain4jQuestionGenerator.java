package io.tiller.adapter.langchain4j;

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.tiller.core.slot.FollowUpQuestions;
import io.tiller.core.slot.ModelResponseException;
import io.tiller.core.slot.ModelResponseParser;
import io.tiller.core.slot.QuestionGenerator;
import io.tiller.core.slot.QuestionRequest;
import java.util.List;
import java.util.Objects;

/// LangChain4j implementation of {@link QuestionGenerator}.
///
/// Asks the model for one short, friendly question per missing field, phrased in
/// the context of what the user already said. Questions the model omits are filled
/// with fallbacks by the clarifier.
///
/// @implNote Thread-safe if the wrapped {@link ChatModel} is.
public class LangChain4jQuestionGenerator implements QuestionGenerator {

    private static final String SYSTEM_PROMPT =
            """
            You write short follow-up questions for a shopping and travel assistant.
            Ask exactly one question per missing field, in the given order, and do not ask \
            about fields that are already known.
            Respond with a JSON object: {"intro": "...", "questions": \
            [{"field": "<field name>", "question": "..."}], "closing": "..."}.
            intro and closing may be empty strings.
            """;

    private final ChatModel model;
    private final ModelResponseParser parser;

    public LangChain4jQuestionGenerator(ChatModel model, ModelResponseParser parser) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public FollowUpQuestions generate(QuestionRequest request) {
        Objects.requireNonNull(request, "request must not be null");

        List<ChatMessage> messages =
                List.of(SystemMessage.from(SYSTEM_PROMPT), UserMessage.from(describe(request)));
        ChatResponse response = model.chat(messages);
        if (response == null || response.aiMessage() == null) {
            throw new IllegalStateException("No response from question model");
        }
        try {
            return parser.parseQuestions(response.aiMessage().text());
        } catch (ModelResponseException e) {
            throw new IllegalStateException("Unparseable question response", e);
        }
    }

    private static String describe(QuestionRequest request) {
        var sb = new StringBuilder();
        sb.append("Intent: ").append(request.intent()).append("\n");
        sb.append("User said: ").append(request.utterance()).append("\n");
        if (!request.knownFields().isEmpty()) {
            sb.append("Known fields:\n");
            request.knownFields()
                    .forEach((k, v) -> sb.append("- ").append(k).append(": ").append(v).append("\n"));
        }
        sb.append("Missing fields: ").append(String.join(", ", request.missingFields()));
        return sb.toString();
    }
}
