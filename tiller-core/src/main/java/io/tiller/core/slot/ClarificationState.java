package io.tiller.core.slot;

/// States of the slot clarification machine for one turn.
public enum ClarificationState {
    /// Collecting field values for a fresh plan.
    COLLECTING,
    /// Questions are outstanding; the turn ends and a later turn resumes.
    SUSPENDED,
    /// Every required field is available; execution may proceed.
    RESOLVED
}
