package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanStep;
import java.io.IOException;
import java.io.Serial;

/// Writes an `ExecutionPlan` as `{"steps":[{"id":..,"capabilities":[..],"parallel":..}]}`.
///
/// @implNote Package-private. Registered by {@link TillerJacksonModule}.
/// @see ExecutionPlanDeserializer for the inverse operation
class ExecutionPlanSerializer extends StdSerializer<ExecutionPlan> {

    @Serial private static final long serialVersionUID = 2250974407411733119L;

    ExecutionPlanSerializer() {
        super(ExecutionPlan.class);
    }

    @Override
    public void serialize(ExecutionPlan plan, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeArrayFieldStart("steps");
        for (PlanStep step : plan.steps()) {
            gen.writeStartObject();
            gen.writeStringField("id", step.id());
            gen.writeArrayFieldStart("capabilities");
            for (String capability : step.capabilities()) {
                gen.writeString(capability);
            }
            gen.writeEndArray();
            gen.writeBooleanField("parallel", step.parallel());
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
