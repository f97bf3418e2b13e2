package io.tiller.server.validation;

/// Makes user-supplied values safe to write to log lines.
///
/// Line breaks are replaced so that a value cannot forge extra log entries, and
/// long values are cut off.
///
/// {@snippet :
/// LOG.infov("Turn for session {0}", LogSanitizer.sanitize(sessionId));
/// }
public final class LogSanitizer {

    static final int MAX_LENGTH = 200;

    private LogSanitizer() {}

    /// Sanitizes a value for logging.
    ///
    /// @param value the value, may be null
    /// @return value without CR/LF, at most {@value #MAX_LENGTH} characters plus an
    /// ellipsis, or `"null"`
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        String flat = value.replace('\r', '_').replace('\n', '_');
        return flat.length() > MAX_LENGTH ? flat.substring(0, MAX_LENGTH) + "..." : flat;
    }
}
