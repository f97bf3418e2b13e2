package io.tiller.core.slot;

import java.io.Serial;

/// Raised when clarification fails and the clarifier is configured to fail closed.
public class ClarificationException extends RuntimeException {

    @Serial private static final long serialVersionUID = -1297715340652873361L;

    public ClarificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
