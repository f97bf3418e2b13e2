package io.tiller.core.router;

/// Kind of consent a gated tier asks for.
public enum ConsentType {
    /// Standing opt-in stored with the user's settings.
    ACCOUNT_TOGGLE("Enable Extended Search in Settings to search more sources"),
    /// One-off confirmation for the current query.
    PER_QUERY("Search deeper?");

    private final String message;

    ConsentType(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
