package io.tiller.serialization.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.slot.FollowUpQuestions;
import io.tiller.core.slot.ModelResponseException;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class JacksonModelResponseParserTest {

    private final JacksonModelResponseParser parser =
            new JacksonModelResponseParser(new ObjectMapper());

    @Nested
    class Fields {

        @Test
        void shouldParseFencedObjectKeepingNulls() throws Exception {
            String content =
                    """
                    ```json
                    {"destination": "Lisbon", "check_in": null, "guests": 2}
                    ```
                    """;

            Map<String, Object> values = parser.parseFields(content);

            assertThat(values)
                    .containsEntry("destination", "Lisbon")
                    .containsEntry("check_in", null)
                    .containsEntry("guests", 2);
        }

        @Test
        void shouldFindObjectInsideProse() throws Exception {
            Map<String, Object> values =
                    parser.parseFields("Sure! Here you go: {\"budget\": \"200\"} Hope that helps.");

            assertThat(values).containsOnly(Map.entry("budget", "200"));
        }

        @Test
        void shouldRejectNonObject() {
            assertThatThrownBy(() -> parser.parseFields("[1, 2]"))
                    .isInstanceOf(ModelResponseException.class);
            assertThatThrownBy(() -> parser.parseFields("no json here"))
                    .isInstanceOf(ModelResponseException.class);
        }
    }

    @Nested
    class Questions {

        @Test
        void shouldParseObjectWithIntroAndClosing() throws Exception {
            String content =
                    """
                    {"intro": "Almost there.",
                     "questions": [{"field": "check_in", "question": "When do you arrive?"}],
                     "closing": "Thanks!"}
                    """;

            FollowUpQuestions questions = parser.parseQuestions(content);

            assertThat(questions.intro()).isEqualTo("Almost there.");
            assertThat(questions.closing()).isEqualTo("Thanks!");
            assertThat(questions.questions())
                    .containsExactly(new FollowUpQuestion("check_in", "When do you arrive?"));
        }

        @Test
        void shouldParseBareArrayInsideProse() throws Exception {
            String content =
                    "Questions: [{\"fieldName\": \"budget\", \"questionText\": \"What budget?\"},"
                            + " {\"field\": \"size\", \"question\": \"  \"}]";

            FollowUpQuestions questions = parser.parseQuestions(content);

            assertThat(questions.questions())
                    .extracting(FollowUpQuestion::fieldName)
                    .containsExactly("budget");
        }

        @Test
        void shouldRejectObjectWithoutQuestions() {
            assertThatThrownBy(() -> parser.parseQuestions("{\"text\": \"hi\"}"))
                    .isInstanceOf(ModelResponseException.class);
        }
    }
}
