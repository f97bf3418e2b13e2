package io.tiller.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.tiller.core.execution.ConsentHalt;
import io.tiller.core.plan.ExecutionPlan;
import io.tiller.core.slot.FieldSet;
import io.tiller.core.suspend.SuspendState;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all Tiller serializer/deserializer pairs.
///
/// - `FieldSet`: `FieldSetSerializer` / `FieldSetDeserializer`, values keep their provenance
/// - `ExecutionPlan`: `ExecutionPlanSerializer` / `ExecutionPlanDeserializer`
/// - `SuspendState`: `SuspendStateSerializer` / `SuspendStateDeserializer`
/// - `ConsentHalt`: `ConsentHaltSerializer` / `ConsentHaltDeserializer`
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see TillerSerializer for the convenience factory API
public class TillerJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4127765090346518260L;

    public TillerJacksonModule() {
        super("TillerJacksonModule");

        addSerializer(FieldSet.class, new FieldSetSerializer());
        addDeserializer(FieldSet.class, new FieldSetDeserializer());

        addSerializer(ExecutionPlan.class, new ExecutionPlanSerializer());
        addDeserializer(ExecutionPlan.class, new ExecutionPlanDeserializer());

        addSerializer(SuspendState.class, new SuspendStateSerializer());
        addDeserializer(SuspendState.class, new SuspendStateDeserializer());

        addSerializer(ConsentHalt.class, new ConsentHaltSerializer());
        addDeserializer(ConsentHalt.class, new ConsentHaltDeserializer());
    }
}
