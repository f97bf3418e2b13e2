package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.plan.PlanStep;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.List;

class ExecutionPlanDeserializer extends StdDeserializer<ExecutionPlan> {

    @Serial private static final long serialVersionUID = -7164190420722468537L;

    ExecutionPlanDeserializer() {
        super(ExecutionPlan.class);
    }

    @Override
    public ExecutionPlan deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper.readTree(p));
    }

    static ExecutionPlan read(JsonNode root) throws IOException {
        JsonNode stepsNode = root != null ? root.get("steps") : null;
        if (stepsNode == null || !stepsNode.isArray()) {
            throw new IOException("Execution plan is missing a 'steps' array");
        }
        List<PlanStep> steps = new ArrayList<>();
        for (JsonNode s : stepsNode) {
            List<String> capabilities = new ArrayList<>();
            for (JsonNode c : s.path("capabilities")) {
                capabilities.add(c.asText());
            }
            try {
                steps.add(
                        new PlanStep(
                                s.path("id").asText(),
                                capabilities,
                                s.path("parallel").asBoolean(false)));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid plan step: " + e.getMessage(), e);
            }
        }
        return new ExecutionPlan(steps);
    }
}
