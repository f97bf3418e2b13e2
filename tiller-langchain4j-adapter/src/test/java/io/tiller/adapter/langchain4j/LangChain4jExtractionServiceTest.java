package io.tiller.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.tiller.core.slot.ConversationMessage;
import io.tiller.core.slot.ExtractionRequest;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.serialization.model.JacksonModelResponseParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jExtractionServiceTest {

    @Mock private ChatModel model;

    private LangChain4jExtractionService service;

    @BeforeEach
    void setUp() {
        service =
                new LangChain4jExtractionService(
                        model, new JacksonModelResponseParser(new ObjectMapper()));
    }

    private static ExtractionRequest request() {
        return new ExtractionRequest(
                "Extract values.",
                List.of("destination", "check_in"),
                Map.of("check_in", "date"),
                List.of(
                        ConversationMessage.user("I want to travel"),
                        ConversationMessage.assistant("Where to?")),
                "Lisbon, arriving April 2nd",
                List.of(new FollowUpQuestion("destination", "Where are you going?")));
    }

    private void answer(String text) {
        when(model.chat(anyList()))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
    }

    @Test
    void shouldReturnOnlyRequestedFields() {
        answer("```json\n{\"destination\": \"Lisbon\", \"check_in\": \"2026-04-02\", \"mood\": \"happy\"}\n```");

        Map<String, Object> values = service.extract(request());

        assertThat(values)
                .containsOnly(
                        Map.entry("destination", "Lisbon"), Map.entry("check_in", "2026-04-02"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldSendSystemPromptContextAndUtterance() {
        answer("{\"destination\": null}");

        service.extract(request());

        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(model).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertThat(messages).hasSize(4);
        assertThat(messages.get(0)).isInstanceOf(SystemMessage.class);
        String system = ((SystemMessage) messages.get(0)).text();
        assertThat(system)
                .contains("Extract values.")
                .contains("- check_in (date)")
                .contains("destination: Where are you going?");
        assertThat(messages.get(2)).isInstanceOf(AiMessage.class);
        assertThat(((UserMessage) messages.get(3)).singleText())
                .isEqualTo("Lisbon, arriving April 2nd");
    }

    @Test
    void shouldFailOnUnparseableResponse() {
        answer("I could not find anything.");

        assertThatThrownBy(() -> service.extract(request()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Unparseable extraction response");
    }

    @Test
    void shouldSkipModelWhenNoFieldsRequested() {
        Map<String, Object> values =
                service.extract(new ExtractionRequest("x", List.of(), null, null, "hi", null));

        assertThat(values).isEmpty();
        verify(model, never()).chat(anyList());
    }
}
