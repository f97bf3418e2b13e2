package io.tiller.core.contract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/// Static metadata describing a capability: its inputs and its ordering
/// relationship to other capabilities.
///
/// A contract is immutable once built. Predecessors and successors are two
/// spellings of the same constraint: `A` listing `B` as successor is equivalent
/// to `B` listing `A` as predecessor.
///
/// ### Contracts
/// - **Precondition**: `name` and `intent` must not be blank
/// - **Postcondition**: all collections are unmodifiable and iteration order is
///   the declaration order
///
/// ### Usage
/// {@snippet :
/// Contract hotels = Contract.builder("travel_search_hotels")
///     .purpose("Search hotels for a destination")
///     .intent("travel")
///     .requiredFields("destination", "duration_days", "adults", "check_in")
///     .optionalFields("check_out", "children")
///     .alias("check_in", "departure_date")
///     .orderHint(100)
///     .build();
/// }
///
/// @param name unique capability identifier, not null
/// @param purpose human-readable description, never null
/// @param intent intent tag, or {@link #ALL_INTENTS} for every intent, not null
/// @param requiredFields fields that must be filled before the capability runs, never null
/// @param optionalFields fields the capability can use when present, never null
/// @param fieldAliases field to alias field; a filled alias satisfies the field, never null
/// @param fieldTypes type hint per field for extraction instructions, never null
/// @param predecessors capabilities that must run before this one, never null
/// @param successors capabilities that must run after this one, never null
/// @param orderHint explicit position among simultaneously ready capabilities, may be null
/// @param defaultMode participation independent of selection, never null
/// @see ContractRegistry
public record Contract(
        String name,
        String purpose,
        String intent,
        Set<String> requiredFields,
        Set<String> optionalFields,
        Map<String, String> fieldAliases,
        Map<String, String> fieldTypes,
        List<String> predecessors,
        List<String> successors,
        Integer orderHint,
        DefaultMode defaultMode) {

    /// Pseudo-intent that makes a contract visible to every intent.
    public static final String ALL_INTENTS = "all";

    public Contract {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        Objects.requireNonNull(intent, "intent must not be null");
        if (intent.isBlank()) {
            throw new IllegalArgumentException("intent must not be blank");
        }
        purpose = purpose != null ? purpose : "";
        requiredFields = requiredFields != null ? orderedCopy(requiredFields) : Set.of();
        optionalFields = optionalFields != null ? orderedCopy(optionalFields) : Set.of();
        fieldAliases = fieldAliases != null ? orderedCopy(fieldAliases) : Map.of();
        fieldTypes = fieldTypes != null ? orderedCopy(fieldTypes) : Map.of();
        predecessors = predecessors != null ? List.copyOf(predecessors) : List.of();
        successors = successors != null ? List.copyOf(successors) : List.of();
        defaultMode = defaultMode != null ? defaultMode : DefaultMode.NONE;
    }

    /// Returns the ordering hint, if one was declared.
    ///
    /// @return the hint, empty when the contract has no explicit position
    public OptionalInt order() {
        return orderHint != null ? OptionalInt.of(orderHint) : OptionalInt.empty();
    }

    /// Returns the alias that can satisfy the given field.
    ///
    /// @param field field name, not null
    /// @return alias field name, or empty if none is declared
    public Optional<String> aliasFor(String field) {
        return Optional.ofNullable(fieldAliases.get(field));
    }

    /// Returns whether this contract applies to the given intent.
    ///
    /// @param candidate intent to test, not null
    /// @return true if the contract's intent matches or is {@link #ALL_INTENTS}
    public boolean appliesTo(String candidate) {
        return intent.equals(candidate) || ALL_INTENTS.equals(intent);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    // Set.copyOf and Map.copyOf do not preserve order; question order depends on it.
    private static Set<String> orderedCopy(Set<String> source) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(source));
    }

    private static Map<String, String> orderedCopy(Map<String, String> source) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    /// Fluent builder for {@link Contract}.
    public static final class Builder {
        private final String name;
        private String purpose = "";
        private String intent = ALL_INTENTS;
        private final Set<String> requiredFields = new LinkedHashSet<>();
        private final Set<String> optionalFields = new LinkedHashSet<>();
        private final Map<String, String> fieldAliases = new LinkedHashMap<>();
        private final Map<String, String> fieldTypes = new LinkedHashMap<>();
        private final List<String> predecessors = new ArrayList<>();
        private final List<String> successors = new ArrayList<>();
        private Integer orderHint;
        private DefaultMode defaultMode = DefaultMode.NONE;

        private Builder(String name) {
            this.name = name;
        }

        public Builder purpose(String purpose) {
            this.purpose = purpose;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public Builder requiredFields(String... fields) {
            requiredFields.addAll(List.of(fields));
            return this;
        }

        public Builder optionalFields(String... fields) {
            optionalFields.addAll(List.of(fields));
            return this;
        }

        /// Declares that a filled `alias` satisfies required `field`.
        public Builder alias(String field, String alias) {
            fieldAliases.put(field, alias);
            return this;
        }

        public Builder fieldType(String field, String typeHint) {
            fieldTypes.put(field, typeHint);
            return this;
        }

        public Builder predecessors(String... names) {
            predecessors.addAll(List.of(names));
            return this;
        }

        public Builder successors(String... names) {
            successors.addAll(List.of(names));
            return this;
        }

        public Builder orderHint(int orderHint) {
            this.orderHint = orderHint;
            return this;
        }

        public Builder defaultMode(DefaultMode defaultMode) {
            this.defaultMode = defaultMode;
            return this;
        }

        public Contract build() {
            return new Contract(
                    name,
                    purpose,
                    intent,
                    requiredFields,
                    optionalFields,
                    fieldAliases,
                    fieldTypes,
                    predecessors,
                    successors,
                    orderHint,
                    defaultMode);
        }
    }
}
