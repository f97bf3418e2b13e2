package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.FieldValue;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes a `FieldSet` as an object keyed by field name.
///
/// ```json
/// {"destination": {"value": "Lisbon", "provenance": "EXTRACTED"}}
/// ```
///
/// @implNote Package-private. Registered by {@link TillerJacksonModule}.
/// @see FieldSetDeserializer for the inverse operation
class FieldSetSerializer extends StdSerializer<FieldSet> {

    @Serial private static final long serialVersionUID = -3385023619011276406L;

    FieldSetSerializer() {
        super(FieldSet.class);
    }

    @Override
    public void serialize(FieldSet fields, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, FieldValue> entry : fields.entries().entrySet()) {
            gen.writeObjectFieldStart(entry.getKey());
            gen.writeFieldName("value");
            provider.defaultSerializeValue(entry.getValue().value(), gen);
            gen.writeStringField("provenance", entry.getValue().provenance().name());
            gen.writeEndObject();
        }
        gen.writeEndObject();
    }
}
