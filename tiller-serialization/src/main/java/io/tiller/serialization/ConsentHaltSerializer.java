package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tiller.core.execution.CapabilityOutcome;
import io.tiller.core.execution.ConsentHalt;
import io.tiller.core.router.ResultItem;
import io.tiller.core.router.RouterCheckpoint;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Writes a `ConsentHalt` with its finished outcomes and routing checkpoints.
///
/// ```json
/// {
///   "stepId": "step_1", "utterance": "headphones",
///   "completed": [{"capability": "profile", "status": "SUCCESS", "output": {...}}],
///   "checkpoints": {"product_search": {"resumeTier": 3, "tierReached": 2,
///       "items": [{"name": "XM5", "price": 279.0, "attributes": {}}],
///       "snippets": [], "sourcesUsed": ["amazon"], "sourcesUnavailable": []}}
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link TillerJacksonModule}.
/// @see ConsentHaltDeserializer for the inverse operation
class ConsentHaltSerializer extends StdSerializer<ConsentHalt> {

    @Serial private static final long serialVersionUID = 5230817964412873021L;

    ConsentHaltSerializer() {
        super(ConsentHalt.class);
    }

    @Override
    public void serialize(ConsentHalt halt, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("stepId", halt.stepId());
        gen.writeStringField("utterance", halt.utterance());

        gen.writeArrayFieldStart("completed");
        for (CapabilityOutcome outcome : halt.completed()) {
            gen.writeStartObject();
            gen.writeStringField("capability", outcome.capability());
            gen.writeStringField("status", outcome.status().name());
            provider.defaultSerializeField("output", outcome.output(), gen);
            if (outcome.error() != null) {
                gen.writeStringField("error", outcome.error());
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeObjectFieldStart("checkpoints");
        for (Map.Entry<String, RouterCheckpoint> entry : halt.checkpoints().entrySet()) {
            RouterCheckpoint checkpoint = entry.getValue();
            gen.writeObjectFieldStart(entry.getKey());
            gen.writeNumberField("resumeTier", checkpoint.resumeTier());
            gen.writeNumberField("tierReached", checkpoint.tierReached());
            gen.writeArrayFieldStart("items");
            for (ResultItem item : checkpoint.items()) {
                gen.writeStartObject();
                gen.writeStringField("name", item.name());
                if (item.price() != null) {
                    gen.writeNumberField("price", item.price());
                }
                provider.defaultSerializeField("attributes", item.attributes(), gen);
                gen.writeEndObject();
            }
            gen.writeEndArray();
            writeStrings("snippets", checkpoint.snippets(), gen);
            writeStrings("sourcesUsed", checkpoint.sourcesUsed(), gen);
            writeStrings("sourcesUnavailable", checkpoint.sourcesUnavailable(), gen);
            gen.writeEndObject();
        }
        gen.writeEndObject();

        gen.writeEndObject();
    }

    private static void writeStrings(String field, List<String> values, JsonGenerator gen)
            throws IOException {
        gen.writeArrayFieldStart(field);
        for (String value : values) {
            gen.writeString(value);
        }
        gen.writeEndArray();
    }
}
