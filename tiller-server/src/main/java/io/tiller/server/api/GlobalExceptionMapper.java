package io.tiller.server.api;

import io.tiller.core.contract.UnknownCapabilityException;
import io.tiller.core.router.UnknownIntentException;
import io.tiller.core.suspend.ConcurrentSuspendException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.Map;
import org.jboss.logging.Logger;

/// Global exception mapper that keeps stack traces out of responses.
///
/// ### Mapping
/// | Exception | Status |
/// |---|---|
/// | {@link UnknownCapabilityException}, {@link UnknownIntentException} | 400 |
/// | {@link ConcurrentSuspendException} | 409 |
/// | {@link WebApplicationException} | its own status |
/// | anything else | 500 |
///
/// ### Response Format
/// ```json
/// {"error": "Human-readable message", "status": 500}
/// ```
///
/// @implNote Thread-safe. Stateless.
@Provider
public class GlobalExceptionMapper implements ExceptionMapper<Throwable> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMapper.class);

    @Override
    public Response toResponse(Throwable exception) {
        if (exception instanceof UnknownCapabilityException
                || exception instanceof UnknownIntentException) {
            LOG.debugv("Rejected unknown name: {0}", exception.getMessage());
            return error(400, exception.getMessage());
        }

        if (exception instanceof ConcurrentSuspendException) {
            LOG.warnv("Concurrent turn detected: {0}", exception.getMessage());
            return error(409, "Session was updated by a concurrent turn; retry the turn");
        }

        if (exception instanceof WebApplicationException wae) {
            int status = wae.getResponse().getStatus();
            String message = sanitize(status, wae.getMessage());

            if (status >= 500) {
                LOG.errorv(exception, "Server error: {0}", message);
            } else {
                LOG.debugv("Client error {0}: {1}", status, message);
            }
            return error(status, message);
        }

        LOG.errorv(exception, "Unhandled exception: {0}", exception.getMessage());
        return error(500, "Internal server error");
    }

    private static Response error(int status, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("error", message, "status", status))
                .build();
    }

    private static String sanitize(int status, String raw) {
        return switch (status) {
            case 400 -> raw != null ? raw : "Bad request";
            case 404 -> raw != null ? raw : "Resource not found";
            case 405 -> "Method not allowed";
            case 415 -> "Unsupported media type";
            default -> {
                if (status >= 500) yield "Internal server error";
                yield raw != null ? raw : "Request failed";
            }
        };
    }
}
