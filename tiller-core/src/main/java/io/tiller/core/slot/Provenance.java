package io.tiller.core.slot;

/// Where a field value came from.
public enum Provenance {
    /// Returned by the extraction service.
    EXTRACTED,
    /// Supplied explicitly by the caller (form input, structured payload).
    USER_SUPPLIED,
    /// Filled from an intent-specific default.
    DEFAULT_INJECTED,
    /// Copied from an already-filled alias field.
    ALIAS_COPIED
}
