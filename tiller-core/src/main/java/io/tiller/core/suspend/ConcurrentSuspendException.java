package io.tiller.core.suspend;

import java.io.Serial;

/// Thrown when a save would overwrite a newer suspend state written by a
/// concurrent turn of the same session.
public class ConcurrentSuspendException extends RuntimeException {

    @Serial private static final long serialVersionUID = 5531948276011384120L;

    public ConcurrentSuspendException(String sessionId, long attemptedVersion) {
        super(
                "Suspend state for session "
                        + sessionId
                        + " changed concurrently (attempted version "
                        + attemptedVersion
                        + ")");
    }
}
