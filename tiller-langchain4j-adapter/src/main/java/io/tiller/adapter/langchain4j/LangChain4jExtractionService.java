package io.tiller.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.tiller.core.slot.ConversationMessage;
import io.tiller.core.slot.ExtractionRequest;
import io.tiller.core.slot.ExtractionService;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.slot.ModelResponseException;
import io.tiller.core.slot.ModelResponseParser;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ExtractionService}.
///
/// Sends one chat request per call: a system message with the instruction and the
/// field list, the bounded conversation window, then the current utterance. The
/// model is asked for a single JSON object, parsed by a {@link ModelResponseParser}.
///
/// Keys the model returns outside the requested field list are dropped.
///
/// @implNote Thread-safe if the wrapped {@link ChatModel} is. Failures are thrown as
/// `IllegalStateException`; the clarifier's degradation policy decides what follows.
///
/// @see LangChain4jQuestionGenerator
public class LangChain4jExtractionService implements ExtractionService {

    private static final Logger logger =
            Logger.getLogger(LangChain4jExtractionService.class.getName());

    private final ChatModel model;
    private final ModelResponseParser parser;

    /// Creates an extraction service.
    ///
    /// @param model the LangChain4j chat model to delegate to, not null
    /// @param parser parser for the model's JSON answer, not null
    public LangChain4jExtractionService(ChatModel model, ModelResponseParser parser) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public Map<String, Object> extract(ExtractionRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        if (request.fields().isEmpty()) {
            return Map.of();
        }

        ChatResponse response = model.chat(buildMessages(request));
        if (response == null || response.aiMessage() == null) {
            throw new IllegalStateException("No response from extraction model");
        }

        Map<String, Object> parsed;
        try {
            parsed = parser.parseFields(response.aiMessage().text());
        } catch (ModelResponseException e) {
            throw new IllegalStateException("Unparseable extraction response", e);
        }

        Map<String, Object> values = new LinkedHashMap<>();
        for (String field : request.fields()) {
            if (parsed.containsKey(field)) {
                values.put(field, parsed.get(field));
            }
        }
        logger.fine("Extracted " + values.keySet() + " from " + request.fields());
        return values;
    }

    /// Builds the ordered message list: system prompt, conversation window, utterance.
    List<ChatMessage> buildMessages(ExtractionRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(SystemMessage.from(buildSystemPrompt(request)));
        for (ConversationMessage message : request.context()) {
            messages.add(
                    message.role() == ConversationMessage.Role.USER
                            ? UserMessage.from(message.content())
                            : AiMessage.from(message.content()));
        }
        messages.add(UserMessage.from(request.utterance()));
        return messages;
    }

    private static String buildSystemPrompt(ExtractionRequest request) {
        var sb = new StringBuilder();
        sb.append(request.instruction().strip()).append("\n\n");

        sb.append("Fields:\n");
        for (String field : request.fields()) {
            sb.append("- ").append(field);
            String type = request.fieldTypes().get(field);
            if (type != null) {
                sb.append(" (").append(type).append(")");
            }
            sb.append("\n");
        }

        if (!request.outstanding().isEmpty()) {
            sb.append("\nThe user is answering these questions:\n");
            for (FollowUpQuestion question : request.outstanding()) {
                sb.append("- ")
                        .append(question.fieldName())
                        .append(": ")
                        .append(question.questionText())
                        .append("\n");
            }
        }

        sb.append("\nRespond with a single JSON object keyed by field name.");
        return sb.toString();
    }
}
