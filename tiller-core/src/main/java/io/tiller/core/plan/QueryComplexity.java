package io.tiller.core.plan;

/// Complexity class of a request, used to pick a pre-authored plan template.
public enum QueryComplexity {
    /// A single fact; a short lookup plan.
    FACTOID,
    /// Typical search and compose flow.
    STANDARD,
    /// Broad research including reviews and ranking.
    DEEP_RESEARCH
}
