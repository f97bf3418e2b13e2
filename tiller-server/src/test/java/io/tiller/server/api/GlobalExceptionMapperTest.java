package io.tiller.server.api;

import static org.assertj.core.api.Assertions.assertThat;

import io.tiller.core.contract.UnknownCapabilityException;
import io.tiller.core.router.UnknownIntentException;
import io.tiller.core.suspend.ConcurrentSuspendException;
import jakarta.ws.rs.BadRequestException;
import jakarta.ws.rs.InternalServerErrorException;
import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GlobalExceptionMapperTest {

    private final GlobalExceptionMapper mapper = new GlobalExceptionMapper();

    private static Map<String, Object> body(Response response) {
        return (Map<String, Object>) response.getEntity();
    }

    @Test
    void shouldMapUnknownCapabilityTo400() {
        Response response = mapper.toResponse(new UnknownCapabilityException("flux"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat((String) body(response).get("error")).contains("flux");
    }

    @Test
    void shouldMapUnknownIntentTo400() {
        Response response = mapper.toResponse(new UnknownIntentException("weather"));

        assertThat(response.getStatus()).isEqualTo(400);
        assertThat((String) body(response).get("error")).contains("weather");
    }

    @Test
    void shouldMapConcurrentTurnTo409() {
        Response response = mapper.toResponse(new ConcurrentSuspendException("s-1", 2));

        assertThat(response.getStatus()).isEqualTo(409);
        assertThat(body(response)).containsEntry("status", 409);
    }

    @Test
    void shouldKeepClientErrorMessages() {
        Response notFound = mapper.toResponse(new NotFoundException("No suspension for session: s-1"));
        Response badRequest = mapper.toResponse(new BadRequestException("Cyclic dependency"));

        assertThat(notFound.getStatus()).isEqualTo(404);
        assertThat(body(notFound)).containsEntry("error", "No suspension for session: s-1");
        assertThat(badRequest.getStatus()).isEqualTo(400);
        assertThat(body(badRequest)).containsEntry("error", "Cyclic dependency");
    }

    @Test
    void shouldHideServerErrorDetails() {
        Response wrapped = mapper.toResponse(new InternalServerErrorException("db password=x"));
        Response unhandled = mapper.toResponse(new IllegalStateException("boom"));

        assertThat(wrapped.getStatus()).isEqualTo(500);
        assertThat(body(wrapped)).containsEntry("error", "Internal server error");
        assertThat(unhandled.getStatus()).isEqualTo(500);
        assertThat(body(unhandled)).containsEntry("error", "Internal server error");
    }
}
