package io.tiller.server.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import java.util.regex.Pattern;

/// Checks values annotated with {@link ValidSessionId}.
///
/// Null passes so that optional fields can carry the annotation; combine with
/// `@NotBlank` where the value is required. Blank values fail.
public class ValidSessionIdValidator implements ConstraintValidator<ValidSessionId, String> {

    private static final Pattern SESSION_ID = Pattern.compile("[a-zA-Z0-9][a-zA-Z0-9._:-]{0,254}");

    @Override
    public boolean isValid(String value, ConstraintValidatorContext context) {
        if (value == null) {
            return true;
        }
        return SESSION_ID.matcher(value).matches();
    }
}
