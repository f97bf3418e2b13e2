package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tiller.core.execution.CapabilityOutcome;
import io.tiller.core.execution.ConsentHalt;
import io.tiller.core.execution.OutcomeStatus;
import io.tiller.core.router.ResultItem;
import io.tiller.core.router.RouterCheckpoint;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a `ConsentHalt` written by {@link ConsentHaltSerializer}.
///
/// Outputs and item attributes come back as plain JSON types, so a result item kept
/// in an output reads as a map.
class ConsentHaltDeserializer extends StdDeserializer<ConsentHalt> {

    @Serial private static final long serialVersionUID = -4471286603905217714L;

    ConsentHaltDeserializer() {
        super(ConsentHalt.class);
    }

    @Override
    public ConsentHalt deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        return read(mapper, mapper.readTree(p));
    }

    /// @return the halt, or null when the node is absent or null
    @SuppressWarnings("unchecked")
    static ConsentHalt read(ObjectMapper mapper, JsonNode root) throws IOException {
        if (root == null || root.isNull()) {
            return null;
        }
        JsonNode stepId = root.get("stepId");
        if (stepId == null || stepId.isNull()) {
            throw new IOException("Consent halt is missing 'stepId'");
        }

        List<CapabilityOutcome> completed = new ArrayList<>();
        for (JsonNode o : root.path("completed")) {
            OutcomeStatus status;
            try {
                status = OutcomeStatus.valueOf(o.path("status").asText());
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown outcome status: " + o.path("status").asText(), e);
            }
            JsonNode output = o.get("output");
            completed.add(
                    new CapabilityOutcome(
                            o.path("capability").asText(),
                            status,
                            output != null && !output.isNull()
                                    ? mapper.treeToValue(output, Map.class)
                                    : Map.of(),
                            o.hasNonNull("error") ? o.get("error").asText() : null,
                            null,
                            null));
        }

        Map<String, RouterCheckpoint> checkpoints = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("checkpoints").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            JsonNode c = entry.getValue();
            List<ResultItem> items = new ArrayList<>();
            for (JsonNode item : c.path("items")) {
                JsonNode attributes = item.get("attributes");
                items.add(
                        new ResultItem(
                                item.path("name").asText(),
                                item.hasNonNull("price") ? item.get("price").decimalValue() : null,
                                attributes != null && !attributes.isNull()
                                        ? mapper.treeToValue(attributes, Map.class)
                                        : Map.of()));
            }
            try {
                checkpoints.put(
                        entry.getKey(),
                        new RouterCheckpoint(
                                c.path("resumeTier").asInt(),
                                c.path("tierReached").asInt(),
                                items,
                                strings(c.path("snippets")),
                                strings(c.path("sourcesUsed")),
                                strings(c.path("sourcesUnavailable"))));
            } catch (IllegalArgumentException e) {
                throw new IOException(
                        "Invalid checkpoint for " + entry.getKey() + ": " + e.getMessage(), e);
            }
        }

        try {
            return new ConsentHalt(
                    stepId.asText(), root.path("utterance").asText(""), completed, checkpoints);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid consent halt: " + e.getMessage(), e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(n -> values.add(n.asText()));
        return values;
    }
}
