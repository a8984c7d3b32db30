package io.flowc.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `WorkflowIR.Builder` that configures POJO builder deserialization.
///
/// Registered via `FlowcJacksonModule.setupModule()` against `WorkflowIR.Builder.class`.
/// Sets `withPrefix = ""` so Jackson maps JSON field names (after snake_case translation)
/// directly to builder method names.
///
/// @see WorkflowIrMixin
/// @see io.flowc.serialization.FlowcJacksonModule
@JsonPOJOBuilder(withPrefix = "")
public abstract class WorkflowIrBuilderMixin {}
