package io.tiller.core.router;

/// Final status of a routing call.
public enum RouterStatus {
    /// Results met the intent's threshold.
    SUCCESS,
    /// A gated tier needs the user's consent before it is fetched.
    CONSENT_REQUIRED,
    /// Tiers are exhausted; results are whatever was found.
    PARTIAL
}
