package io.tiller.server.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import jakarta.validation.Path;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jboss.logging.Logger;

/// Maps Bean Validation failures on turn and session requests to HTTP 400.
///
/// The body extends the common error format with the sorted list of rejected
/// fields, so a client can highlight them without parsing the message:
/// ```json
/// {"error": "intent: intent is required; sessionId: must be a valid identifier",
///  "status": 400, "fields": ["intent", "sessionId"]}
/// ```
///
/// @implNote Thread-safe. Stateless.
/// @see io.tiller.server.api.GlobalExceptionMapper
@Provider
public class ConstraintViolationExceptionMapper
        implements ExceptionMapper<ConstraintViolationException> {

    private static final Logger LOG = Logger.getLogger(ConstraintViolationExceptionMapper.class);

    @Override
    public Response toResponse(ConstraintViolationException exception) {
        Map<String, List<String>> byField = groupByField(exception);

        List<String> parts = new ArrayList<>();
        byField.forEach((field, messages) -> parts.add(field + ": " + String.join(", ", messages)));
        String message = String.join("; ", parts);

        LOG.debugv("Rejected request on fields {0}: {1}", byField.keySet(), message);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", message);
        body.put("status", 400);
        body.put("fields", List.copyOf(byField.keySet()));
        return Response.status(Response.Status.BAD_REQUEST)
                .type(MediaType.APPLICATION_JSON)
                .entity(body)
                .build();
    }

    /// Groups violation messages by field, fields and messages both sorted.
    static Map<String, List<String>> groupByField(ConstraintViolationException exception) {
        Map<String, List<String>> byField = new TreeMap<>();
        for (ConstraintViolation<?> violation : exception.getConstraintViolations()) {
            byField.computeIfAbsent(leafName(violation), k -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        byField.values().forEach(messages -> messages.sort(Comparator.naturalOrder()));
        return byField;
    }

    /// Returns the last node of the property path: `handleTurn.body.intent` becomes `intent`.
    static String leafName(ConstraintViolation<?> violation) {
        String name = null;
        for (Path.Node node : violation.getPropertyPath()) {
            name = node.getName();
        }
        return name != null ? name : "request";
    }
}
