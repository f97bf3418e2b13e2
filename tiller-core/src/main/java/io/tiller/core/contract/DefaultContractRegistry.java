package io.tiller.core.contract;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

/// Default thread-safe implementation of {@link ContractRegistry}.
///
/// Keeps registration order so that plan expansion and field collection are
/// deterministic across runs.
///
/// @implNote Thread-safe. Lookups use a ConcurrentHashMap; the ordered name
/// list is copy-on-write since writes only happen at startup.
public final class DefaultContractRegistry implements ContractRegistry {

    private static final Logger logger = Logger.getLogger(DefaultContractRegistry.class.getName());

    private final Map<String, Contract> contracts = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    public DefaultContractRegistry() {}

    /// Creates a registry with initial contracts.
    ///
    /// @param initial contracts to register in order, not null
    public DefaultContractRegistry(List<Contract> initial) {
        Objects.requireNonNull(initial, "initial must not be null");
        initial.forEach(this::register);
    }

    @Override
    public synchronized void register(Contract contract) {
        Objects.requireNonNull(contract, "contract must not be null");
        if (contracts.put(contract.name(), contract) != null) {
            logger.warning("Replacing contract: " + contract.name());
        } else {
            order.add(contract.name());
        }
    }

    @Override
    public Optional<Contract> get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return Optional.ofNullable(contracts.get(name));
    }

    @Override
    public List<Contract> all() {
        return order.stream().map(contracts::get).toList();
    }

    @Override
    public boolean contains(String name) {
        Objects.requireNonNull(name, "name must not be null");
        return contracts.containsKey(name);
    }

    @Override
    public int size() {
        return contracts.size();
    }
}
