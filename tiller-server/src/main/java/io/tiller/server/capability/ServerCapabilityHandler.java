package io.tiller.server.capability;

import io.tiller.core.execution.CapabilityHandler;

/// CDI-discoverable {@link CapabilityHandler} bound to one capability name.
///
/// Beans implementing this interface are registered with the environment's
/// handler registry at startup, next to the capabilities served by the tiered
/// router.
///
/// ### Usage
/// {@snippet :
/// @ApplicationScoped
/// public class ComposeHandler implements ServerCapabilityHandler {
///     public String capability() { return "product_compose"; }
///     public CapabilityOutcome handle(CapabilityInvocation invocation) { ... }
/// }
/// }
///
/// @see io.tiller.server.config.TillerEnvironmentProducer
public interface ServerCapabilityHandler extends CapabilityHandler {

    /// Returns the capability this handler serves.
    ///
    /// @return capability name, not null
    String capability();
}
