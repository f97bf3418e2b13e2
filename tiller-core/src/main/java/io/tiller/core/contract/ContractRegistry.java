package io.tiller.core.contract;

import java.util.List;
import java.util.Optional;

/// Name-keyed registry of capability contracts.
///
/// Contracts are registered explicitly at startup; nothing is discovered from
/// the classpath or filesystem at runtime.
///
/// ### Usage
/// {@snippet :
/// ContractRegistry registry = new DefaultContractRegistry();
/// registry.register(Contract.builder("product_search").intent("product").build());
///
/// Contract contract = registry.require("product_search");
/// List<Contract> forProduct = registry.forIntent("product");
/// }
///
/// @implNote Implementations should be thread-safe. Registration normally
/// happens once during startup, lookups happen on every turn.
///
/// @see Contract
/// @see io.tiller.core.plan.DependencyPlanner
public interface ContractRegistry {

    /// Registers a contract, replacing any contract with the same name.
    ///
    /// @apiNote **Side effects**: Modifies the registry
    ///
    /// @param contract the contract to register, not null
    /// @throws NullPointerException if contract is null
    void register(Contract contract);

    /// Looks up a contract by capability name.
    ///
    /// @param name capability name, not null
    /// @return the contract if registered, empty otherwise
    Optional<Contract> get(String name);

    /// Looks up a contract that must exist.
    ///
    /// @param name capability name, not null
    /// @return the registered contract, never null
    /// @throws UnknownCapabilityException if no contract has this name
    default Contract require(String name) {
        return get(name).orElseThrow(() -> new UnknownCapabilityException(name));
    }

    /// Returns all contracts in registration order.
    ///
    /// @return unmodifiable list, never null
    List<Contract> all();

    /// Returns the contracts that apply to an intent, including those tagged
    /// {@link Contract#ALL_INTENTS}.
    ///
    /// @param intent the active intent, not null
    /// @return unmodifiable list in registration order, never null
    default List<Contract> forIntent(String intent) {
        return all().stream().filter(c -> c.appliesTo(intent)).toList();
    }

    default boolean contains(String name) {
        return get(name).isPresent();
    }

    default int size() {
        return all().size();
    }
}
