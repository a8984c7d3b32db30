package io.flowc.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.WorkflowIR;
import io.flowc.serialization.mixin.WorkflowIrBuilderMixin;
import io.flowc.serialization.mixin.WorkflowIrMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all flowc IR serialization configuration in one place.
///
/// Covers two registration strategies:
///
/// **Custom serializer/deserializer pair** for the recursive agent tree, where the `"type"`
/// discriminator selects leaf or composite handling:
/// - `AgentIR` - `AgentIrSerializer` / `AgentIrDeserializer`
///
/// **Mixin/builder pair** for the immutable workflow container:
/// - `WorkflowIR` + `WorkflowIR.Builder`
///
/// The small IR records (`WorkflowMetadata`, `TeleporterIR`, `UserInputIR`) bind through
/// Jackson's record support and need no registration.
///
/// @see WorkflowIrSerializer for the convenience factory API
public class FlowcJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2204719683514470532L;

    /// Constructs the module and registers the agent serializer/deserializer pair.
    ///
    /// Mixin registrations are deferred to {@link #setupModule} where the `SetupContext`
    /// is available.
    public FlowcJacksonModule() {
        super("FlowcJacksonModule");

        addSerializer(AgentIR.class, new AgentIrSerializer());
        addDeserializer(AgentIR.class, new AgentIrDeserializer());
    }

    /// Applies mixin annotations to the workflow container and its builder.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(WorkflowIR.class, WorkflowIrMixin.class);
        context.setMixInAnnotations(WorkflowIR.Builder.class, WorkflowIrBuilderMixin.class);
    }
}
