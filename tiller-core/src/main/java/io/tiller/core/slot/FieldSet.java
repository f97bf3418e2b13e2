package io.tiller.core.slot;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Mutable map of field values tagged with provenance.
///
/// A field counts as filled when it holds a non-null value that is not a blank
/// string. `null` and blank values are never stored, so a field is either filled
/// or absent.
///
/// ### Usage
/// {@snippet :
/// FieldSet fields = new FieldSet();
/// fields.put("destination", "Lisbon", Provenance.EXTRACTED);
/// fields.isFilled("destination"); // true
/// fields.provenance("destination"); // Optional[EXTRACTED]
/// }
///
/// @implNote **Not thread-safe.** A field set is owned by one turn at a time.
/// Use {@link #copy()} before handing it to another owner.
public final class FieldSet {

    private final Map<String, FieldValue> entries = new LinkedHashMap<>();

    public FieldSet() {}

    /// Creates a field set from plain values with a single provenance.
    ///
    /// @param values field values, null or blank values are skipped, not null
    /// @param provenance provenance for every value, not null
    /// @return new field set, never null
    public static FieldSet of(Map<String, ?> values, Provenance provenance) {
        Objects.requireNonNull(values, "values must not be null");
        FieldSet fields = new FieldSet();
        values.forEach((name, value) -> fields.put(name, value, provenance));
        return fields;
    }

    /// Sets a field.
    ///
    /// @param name field name, not null
    /// @param value field value; null or blank strings are ignored
    /// @param provenance origin of the value, not null
    /// @return true if the value was stored
    public boolean put(String name, Object value, Provenance provenance) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
        if (!isPresent(value)) {
            return false;
        }
        entries.put(name, new FieldValue(value, provenance));
        return true;
    }

    /// Restores a previously captured entry.
    ///
    /// @param name field name, not null
    /// @param entry value with provenance, not null
    public void put(String name, FieldValue entry) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(entry, "entry must not be null");
        entries.put(name, entry);
    }

    public Optional<Object> get(String name) {
        FieldValue entry = entries.get(name);
        return entry != null ? Optional.of(entry.value()) : Optional.empty();
    }

    public Optional<Provenance> provenance(String name) {
        FieldValue entry = entries.get(name);
        return entry != null ? Optional.of(entry.provenance()) : Optional.empty();
    }

    public boolean isFilled(String name) {
        return entries.containsKey(name);
    }

    public boolean remove(String name) {
        return entries.remove(name) != null;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /// Returns the entries with provenance, in insertion order.
    ///
    /// @return unmodifiable view, never null
    public Map<String, FieldValue> entries() {
        return Collections.unmodifiableMap(entries);
    }

    /// Returns plain values without provenance, in insertion order.
    ///
    /// @return new mutable map, never null
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>();
        entries.forEach((name, entry) -> values.put(name, entry.value()));
        return values;
    }

    /// Copies entries from another field set, overwriting existing ones.
    ///
    /// @param other source of entries, not null
    public void putAll(FieldSet other) {
        Objects.requireNonNull(other, "other must not be null");
        entries.putAll(other.entries);
    }

    /// Returns an independent copy.
    ///
    /// @return new field set with the same entries, never null
    public FieldSet copy() {
        FieldSet copy = new FieldSet();
        copy.entries.putAll(entries);
        return copy;
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof CharSequence text) || !text.toString().isBlank();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldSet other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        // Names and provenance only; values may be personal data.
        StringBuilder sb = new StringBuilder("FieldSet{");
        entries.forEach((name, entry) -> sb.append(name).append('=').append(entry.provenance()).append(", "));
        if (!entries.isEmpty()) {
            sb.setLength(sb.length() - 2);
        }
        return sb.append('}').toString();
    }
}
