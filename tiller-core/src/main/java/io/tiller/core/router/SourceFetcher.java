package io.tiller.core.router;

/// Performs the call to one external source.
///
/// Implementations may block; the router enforces the source's timeout and
/// cancels the call when it expires.
@FunctionalInterface
public interface SourceFetcher {

    /// Fetches results from a source.
    ///
    /// @param source source to call, not null
    /// @param request query, not null
    /// @return payload, never null
    /// @throws Exception if the call fails
    SourcePayload fetch(SourceDefinition source, FetchRequest request) throws Exception;
}
