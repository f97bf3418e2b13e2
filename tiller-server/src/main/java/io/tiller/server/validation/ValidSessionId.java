package io.tiller.server.validation;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.ElementType.TYPE_USE;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;
import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

/// Validates that a string is a safe session or actor identifier.
///
/// A valid identifier starts with an alphanumeric character, contains only
/// alphanumerics, dots, hyphens, underscores and colons, and is at most 255
/// characters long. Session ids end up in durable-store keys and log lines.
///
/// ### Usage
/// {@snippet :
/// @POST
/// @Path("/{sessionId}/turns")
/// public Response turn(@PathParam("sessionId") @ValidSessionId String sessionId, ...) { ... }
/// }
///
/// @see ValidSessionIdValidator
@Target({FIELD, PARAMETER, TYPE_USE})
@Retention(RUNTIME)
@Constraint(validatedBy = ValidSessionIdValidator.class)
@Documented
public @interface ValidSessionId {

    String message() default
            "must be a valid identifier (alphanumeric, '.', '-', '_', ':'; 1-255 chars)";

    Class<?>[] groups() default {};

    Class<? extends Payload>[] payload() default {};
}
