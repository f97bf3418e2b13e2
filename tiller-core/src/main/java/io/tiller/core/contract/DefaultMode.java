package io.tiller.core.contract;

/// How a contract participates in a plan independently of user selection.
///
/// @see Contract#defaultMode()
public enum DefaultMode {
    /// Only planned when selected or pulled in as a dependency.
    NONE,
    /// Always added to plans for the contract's intent.
    ALWAYS_REQUIRED,
    /// Added once every one of its predecessors is already in the plan.
    ALWAYS_OPTIONAL
}
