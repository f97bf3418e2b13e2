package io.tiller.core.slot;

import java.util.Objects;

/// A filled field value with its provenance.
///
/// @param value the value, not null
/// @param provenance origin of the value, not null
public record FieldValue(Object value, Provenance provenance) {

    public FieldValue {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
    }
}
