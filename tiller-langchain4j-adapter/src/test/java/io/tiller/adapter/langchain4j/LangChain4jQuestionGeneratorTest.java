package io.tiller.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.slot.FollowUpQuestions;
import io.tiller.core.slot.QuestionRequest;
import io.tiller.serialization.model.JacksonModelResponseParser;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jQuestionGeneratorTest {

    @Mock private ChatModel model;

    private final QuestionRequest request =
            new QuestionRequest(
                    "travel", List.of("check_in"), Map.of("destination", "Lisbon"), "Hotels in Lisbon");

    private LangChain4jQuestionGenerator generator() {
        return new LangChain4jQuestionGenerator(
                model, new JacksonModelResponseParser(new ObjectMapper()));
    }

    @Test
    void shouldParseGeneratedQuestions() {
        when(model.chat(anyList()))
                .thenReturn(
                        ChatResponse.builder()
                                .aiMessage(
                                        AiMessage.from(
                                                "{\"intro\": \"Lisbon, lovely.\", \"questions\": [{\"field\": \"check_in\", \"question\": \"When do you arrive?\"}]}"))
                                .build());

        FollowUpQuestions questions = generator().generate(request);

        assertThat(questions.intro()).isEqualTo("Lisbon, lovely.");
        assertThat(questions.questions())
                .containsExactly(new FollowUpQuestion("check_in", "When do you arrive?"));
    }

    @Test
    void shouldFailOnUnparseableResponse() {
        when(model.chat(anyList()))
                .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("When?")).build());

        assertThatThrownBy(() -> generator().generate(request))
                .isInstanceOf(IllegalStateException.class);
    }
}
