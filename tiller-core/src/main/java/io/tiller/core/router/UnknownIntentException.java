package io.tiller.core.router;

import java.io.Serial;

/// Thrown when the routing table has no rules for an intent.
public class UnknownIntentException extends RuntimeException {

    @Serial private static final long serialVersionUID = 8046520196736101432L;

    public UnknownIntentException(String intent) {
        super("No routing rules for intent: " + intent);
    }
}
