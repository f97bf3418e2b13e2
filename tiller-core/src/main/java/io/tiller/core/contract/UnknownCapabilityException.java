package io.tiller.core.contract;

import java.io.Serial;

/// Thrown when a plan or lookup references a capability that was never registered.
///
/// @see ContractRegistry#require(String)
public class UnknownCapabilityException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3816409558712204935L;

    private final String capability;

    public UnknownCapabilityException(String capability) {
        super("Unknown capability: " + capability);
        this.capability = capability;
    }

    public String getCapability() {
        return capability;
    }
}
