package io.tiller.core.slot;

import io.tiller.core.contract.Contract;
import io.tiller.core.contract.ContractRegistry;
import io.tiller.core.plan.ExecutionPlan;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/// Union of field requirements across the capabilities of a plan.
///
/// Alias conflicts (two planned capabilities aliasing the same field to
/// different fields) resolve to the mapping of the capability planned first;
/// the conflict is logged.
///
/// @param required required fields in plan order, never null
/// @param optional optional fields not also required, in plan order, never null
/// @param aliases field to alias field, never null
/// @param fieldTypes type hints merged across contracts, never null
/// @param owners field to the capabilities declaring it, never null
public record FieldRequirements(
        Set<String> required,
        Set<String> optional,
        Map<String, String> aliases,
        Map<String, String> fieldTypes,
        Map<String, List<String>> owners) {

    private static final Logger logger = Logger.getLogger(FieldRequirements.class.getName());

    public FieldRequirements {
        required = Collections.unmodifiableSet(new LinkedHashSet<>(required));
        optional = Collections.unmodifiableSet(new LinkedHashSet<>(optional));
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
        fieldTypes = Collections.unmodifiableMap(new LinkedHashMap<>(fieldTypes));
        Map<String, List<String>> ownerCopy = new LinkedHashMap<>();
        owners.forEach((field, names) -> ownerCopy.put(field, List.copyOf(names)));
        owners = Collections.unmodifiableMap(ownerCopy);
    }

    /// Collects requirements for every capability in a plan.
    ///
    /// @param plan the execution plan, not null
    /// @param registry contract source, not null
    /// @return merged requirements, never null
    /// @throws io.tiller.core.contract.UnknownCapabilityException if the plan names
    ///         an unregistered capability
    public static FieldRequirements of(ExecutionPlan plan, ContractRegistry registry) {
        Set<String> required = new LinkedHashSet<>();
        Set<String> optional = new LinkedHashSet<>();
        Map<String, String> aliases = new LinkedHashMap<>();
        Map<String, String> types = new LinkedHashMap<>();
        Map<String, List<String>> owners = new LinkedHashMap<>();

        for (String capability : plan.capabilityNames()) {
            Contract contract = registry.require(capability);
            for (String field : contract.requiredFields()) {
                required.add(field);
                owners.computeIfAbsent(field, k -> new ArrayList<>()).add(capability);
            }
            for (String field : contract.optionalFields()) {
                optional.add(field);
                owners.computeIfAbsent(field, k -> new ArrayList<>()).add(capability);
            }
            contract.fieldAliases()
                    .forEach(
                            (field, alias) -> {
                                String existing = aliases.putIfAbsent(field, alias);
                                if (existing != null && !existing.equals(alias)) {
                                    logger.warning(
                                            "Conflicting alias for field "
                                                    + field
                                                    + ": keeping "
                                                    + existing
                                                    + ", ignoring "
                                                    + alias
                                                    + " from "
                                                    + capability);
                                }
                            });
            contract.fieldTypes().forEach(types::putIfAbsent);
        }
        optional.removeAll(required);
        return new FieldRequirements(required, optional, aliases, types, owners);
    }

    public Optional<String> aliasFor(String field) {
        return Optional.ofNullable(aliases.get(field));
    }

    /// Returns every field name a value may legitimately be extracted for.
    ///
    /// @return required, optional and alias fields, never null
    public Set<String> knownFields() {
        Set<String> known = new LinkedHashSet<>(required);
        known.addAll(optional);
        known.addAll(aliases.values());
        return known;
    }

    /// Copies filled alias values into unfilled fields.
    ///
    /// @param fields the field set to update, not null
    /// @return names of the fields that were satisfied through an alias
    public List<String> applyAliases(FieldSet fields) {
        List<String> copied = new ArrayList<>();
        aliases.forEach(
                (field, alias) -> {
                    if (!fields.isFilled(field) && fields.isFilled(alias)) {
                        fields.put(field, fields.get(alias).orElseThrow(), Provenance.ALIAS_COPIED);
                        copied.add(field);
                    }
                });
        return copied;
    }

    /// Returns the required fields still unfilled, in order.
    ///
    /// @param fields current values, not null
    /// @return missing required fields, never null
    public List<String> missingRequired(FieldSet fields) {
        return required.stream().filter(f -> !fields.isFilled(f)).toList();
    }
}
