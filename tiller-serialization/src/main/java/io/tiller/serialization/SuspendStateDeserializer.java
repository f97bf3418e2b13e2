package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.suspend.SuspendState;
import java.io.IOException;
import java.io.Serial;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Reads a `SuspendState` written by {@link SuspendStateSerializer}.
///
/// Nested types are read from the `JsonNode` tree directly. A missing `version`
/// reads as `0` so that states written before versioning can still be resumed. A
/// missing `consentHalt` reads as a clarification state.
class SuspendStateDeserializer extends StdDeserializer<SuspendState> {

    @Serial private static final long serialVersionUID = -2095716305658436013L;

    SuspendStateDeserializer() {
        super(SuspendState.class);
    }

    @Override
    public SuspendState deserialize(JsonParser p, DeserializationContext ctx) throws IOException {
        ObjectMapper mapper = (ObjectMapper) p.getCodec();
        JsonNode root = mapper.readTree(p);

        String sessionId = requiredText(root, "sessionId");
        String intent = requiredText(root, "intent");

        List<FollowUpQuestion> questions = new ArrayList<>();
        for (JsonNode q : root.path("outstandingQuestions")) {
            questions.add(
                    new FollowUpQuestion(
                            q.path("fieldName").asText(), q.path("questionText").asText()));
        }

        Map<String, List<String>> owners = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("fieldOwners").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            List<String> names = new ArrayList<>();
            entry.getValue().forEach(n -> names.add(n.asText()));
            owners.put(entry.getKey(), names);
        }

        return new SuspendState(
                sessionId,
                intent,
                FieldSetDeserializer.read(mapper, root.get("fields")),
                questions,
                ExecutionPlanDeserializer.read(root.get("plan")),
                owners,
                root.path("version").asLong(0L),
                ConsentHaltDeserializer.read(mapper, root.get("consentHalt")));
    }

    private static String requiredText(JsonNode root, String field) throws IOException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new IOException("Suspend state is missing '" + field + "'");
        }
        return node.asText();
    }
}
