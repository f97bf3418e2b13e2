package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.slot.Provenance;
import java.io.IOException;
import java.io.Serial;
import java.util.Iterator;
import java.util.Map;

/// Reads a `FieldSet` written by {@link FieldSetSerializer}.
///
/// Values come back as plain JSON types (strings, numbers, booleans, lists, maps).
/// Entries with a `null` value are skipped since a field set holds filled values only.
class FieldSetDeserializer extends StdDeserializer<FieldSet> {

    @Serial private static final long serialVersionUID = 6702364458613360861L;

    FieldSetDeserializer() {
        super(FieldSet.class);
    }

    @Override
    public FieldSet deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);
        return read(mapper, root);
    }

    static FieldSet read(ObjectMapper mapper, JsonNode root) throws IOException {
        FieldSet fields = new FieldSet();
        if (root == null || root.isNull()) {
            return fields;
        }
        Iterator<Map.Entry<String, JsonNode>> it = root.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode value = entry.getValue().get("value");
            if (value == null || value.isNull()) {
                continue;
            }
            JsonNode provenance = entry.getValue().get("provenance");
            Provenance origin;
            try {
                origin =
                        provenance != null
                                ? Provenance.valueOf(provenance.asText())
                                : Provenance.EXTRACTED;
            } catch (IllegalArgumentException e) {
                throw new IOException(
                        "Unknown provenance for field " + entry.getKey() + ": " + provenance.asText(),
                        e);
            }
            fields.put(entry.getKey(), mapper.treeToValue(value, Object.class), origin);
        }
        return fields;
    }
}
