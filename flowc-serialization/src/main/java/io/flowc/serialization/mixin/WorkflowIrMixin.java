package io.flowc.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.flowc.core.ir.WorkflowIR;

/// Jackson mixin that binds `WorkflowIR` deserialization to its builder.
///
/// Applied to `WorkflowIR.class` via `FlowcJacksonModule.setupModule()`. Besides selecting
/// the builder it fixes the property order, so that serialized output is stable, and exposes
/// the two `has*` flags, which are not bean getters.
///
/// @apiNote The companion mixin {@link WorkflowIrBuilderMixin} must also be registered so
/// Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see WorkflowIrBuilderMixin
/// @see io.flowc.serialization.FlowcJacksonModule
@JsonDeserialize(builder = WorkflowIR.Builder.class)
@JsonPropertyOrder({
    "metadata",
    "project_path",
    "tab_ids",
    "has_start_node",
    "has_end_node",
    "global_variables",
    "roots",
    "all_agents",
    "teleporters",
    "user_inputs"
})
public abstract class WorkflowIrMixin {

    @JsonProperty("has_start_node")
    public abstract boolean hasStartNode();

    @JsonProperty("has_end_node")
    public abstract boolean hasEndNode();
}
