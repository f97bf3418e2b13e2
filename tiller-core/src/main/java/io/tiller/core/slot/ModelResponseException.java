package io.tiller.core.slot;

/// Thrown when language-model output cannot be parsed into the expected shape.
public class ModelResponseException extends Exception {

    public ModelResponseException(String message) {
        super(message);
    }

    public ModelResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
