package io.tiller.server.validation;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.server.api.TurnResource.TurnBody;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class ConstraintViolationExceptionMapperTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    private final ConstraintViolationExceptionMapper mapper =
            new ConstraintViolationExceptionMapper();

    @BeforeAll
    static void setup() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldListRejectedFieldsInSortedOrder() {
        TurnBody body = new TurnBody("../x", "", null, null, null, null, null, null, null);
        Set<ConstraintViolation<TurnBody>> violations = validator.validate(body);

        Response response = mapper.toResponse(new ConstraintViolationException(violations));

        assertThat(response.getStatus()).isEqualTo(400);
        Map<String, Object> entity = (Map<String, Object>) response.getEntity();
        assertThat(entity.get("status")).isEqualTo(400);
        assertThat((List<String>) entity.get("fields"))
                .containsExactly("actorId", "intent", "utterance");
        assertThat((String) entity.get("error"))
                .contains("intent: intent is required")
                .contains("utterance: utterance is required");
    }

    @Test
    void shouldGroupMessagesPerField() {
        TurnBody body = new TurnBody(null, " ", "hi", null, null, null, null, null, null);
        Set<ConstraintViolation<TurnBody>> violations = validator.validate(body);

        Map<String, List<String>> grouped =
                ConstraintViolationExceptionMapper.groupByField(
                        new ConstraintViolationException(violations));

        assertThat(grouped).containsOnlyKeys("intent");
        assertThat(grouped.get("intent")).containsExactly("intent is required");
    }
}
