package io.tiller.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.tiller.core.slot.FollowUpQuestion;
import io.tiller.core.suspend.SuspendState;
import java.io.IOException;
import java.io.Serial;
import java.util.List;
import java.util.Map;

/// Writes a `SuspendState` with its fields, questions, plan and field owners, plus
/// the consent halt when the plan is waiting for consent.
///
/// Emitted JSON shape:
/// ```json
/// {
///   "sessionId": "s1", "intent": "travel", "version": 2,
///   "fields": {"destination": {"value": "Lisbon", "provenance": "EXTRACTED"}},
///   "outstandingQuestions": [{"fieldName": "check_in", "questionText": "When?"}],
///   "plan": {"steps": [...]},
///   "fieldOwners": {"check_in": ["travel_search_hotels"]},
///   "consentHalt": null
/// }
/// ```
///
/// @implNote Package-private. Registered by {@link TillerJacksonModule}.
/// @see SuspendStateDeserializer for the inverse operation
class SuspendStateSerializer extends StdSerializer<SuspendState> {

    @Serial private static final long serialVersionUID = 8917347705853125330L;

    SuspendStateSerializer() {
        super(SuspendState.class);
    }

    @Override
    public void serialize(SuspendState state, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("sessionId", state.sessionId());
        gen.writeStringField("intent", state.intent());
        gen.writeNumberField("version", state.version());

        provider.defaultSerializeField("fields", state.fields(), gen);

        gen.writeArrayFieldStart("outstandingQuestions");
        for (FollowUpQuestion question : state.outstandingQuestions()) {
            gen.writeStartObject();
            gen.writeStringField("fieldName", question.fieldName());
            gen.writeStringField("questionText", question.questionText());
            gen.writeEndObject();
        }
        gen.writeEndArray();

        provider.defaultSerializeField("plan", state.plan(), gen);

        gen.writeObjectFieldStart("fieldOwners");
        for (Map.Entry<String, List<String>> entry : state.fieldOwners().entrySet()) {
            gen.writeArrayFieldStart(entry.getKey());
            for (String owner : entry.getValue()) {
                gen.writeString(owner);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();

        provider.defaultSerializeField("consentHalt", state.consentHalt(), gen);

        gen.writeEndObject();
    }
}
