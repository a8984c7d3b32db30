package io.flowc.core.template;

import io.flowc.core.ir.AgentIR;
import io.flowc.core.ir.CallbackIR;
import io.flowc.core.ir.SchemaIR;
import io.flowc.core.ir.ToolIR;
import io.flowc.core.ir.WorkflowIR;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Build-time interpolation of known global variables into compiled agents.
///
/// A pure function: every call returns new values and never mutates its input, so
/// configuration objects shared by several agents cannot alias. Strings are resolved through
/// the {@link TemplateResolver}; maps and lists are rebuilt recursively; other values are
/// returned unchanged.
///
/// Every string-valued configuration field of an agent is resolved: name, instruction,
/// description, model, output key, condition, settings, context variable values and the text
/// fields of its tools, callbacks and schemas. Ids, source node ids and enum-valued fields are
/// left alone.
///
/// A value may name other keys (`{a: "{b}", b: "x"}`); a string is re-resolved until it no
/// longer changes, so applying the substitution to its own output changes nothing. Keys that
/// reference each other in a cycle are rejected when the substitution is created.
///
/// @implNote Immutable and thread-safe.
public final class Substitution {

    private final TemplateResolver resolver;
    private final Map<String, String> values;

    /// @param resolver placeholder resolver, not null
    /// @param values known values by name, not null
    /// @throws IllegalArgumentException if a value does not settle, e.g. `{a: "{b}", b: "{a}"}`
    public Substitution(TemplateResolver resolver, Map<String, String> values) {
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.values =
                Collections.unmodifiableMap(
                        new LinkedHashMap<>(Objects.requireNonNull(values, "values must not be null")));
        this.values.forEach(
                (key, value) -> {
                    if (value == null) {
                        return;
                    }
                    String settled = settle(value);
                    if (settled == null || namesKey(settled)) {
                        throw new IllegalArgumentException(
                                "Global variable '" + key + "' references itself through " + value);
                    }
                });
    }

    /// @param values known values by name, not null
    /// @return substitution backed by {@link SimpleTemplateResolver}, never null
    /// @throws IllegalArgumentException if the values reference each other in a cycle
    public static Substitution of(Map<String, String> values) {
        return new Substitution(new SimpleTemplateResolver(), values);
    }

    /// Resolves one string until no placeholder naming a known key is left.
    ///
    /// @param text text, may be null
    /// @return resolved text, null if `text` is null
    /// @throws IllegalArgumentException if the text keeps changing
    public String substitute(String text) {
        if (text == null) {
            return null;
        }
        String resolved = settle(text);
        if (resolved == null) {
            throw new IllegalArgumentException("Placeholders in '" + text + "' do not settle");
        }
        return resolved;
    }

    /// One resolver pass per level of nesting; an acyclic mapping settles within `size + 1`
    /// passes.
    ///
    /// @return the settled text, null if it is still changing after the last pass
    private String settle(String text) {
        String current = text;
        for (int pass = 0; pass <= values.size(); pass++) {
            String next = resolver.resolve(current, values);
            if (Objects.equals(next, current)) {
                return current;
            }
            current = next;
        }
        return null;
    }

    /// @return true if a placeholder naming a known key is still present
    private boolean namesKey(String text) {
        Map<String, String> markers = new LinkedHashMap<>();
        values.keySet().forEach(k -> markers.put(k, ""));
        return !text.equals(resolver.resolve(text, markers));
    }

    /// Resolves every string inside a value tree of maps, lists and scalars.
    ///
    /// @param value value tree, may be null
    /// @return new tree with resolved strings, never the same map or list instance
    public Object substituteValue(Object value) {
        if (value instanceof String s) {
            return substitute(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, substituteValue(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(substituteValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /// Resolves an agent and all its subagents.
    ///
    /// @param agent agent tree, not null
    /// @return new agent tree, never null
    public AgentIR apply(AgentIR agent) {
        List<AgentIR> subagents = agent.getSubagents().stream().map(this::apply).toList();
        Map<String, String> variables = new LinkedHashMap<>();
        agent.getContextVariables().forEach((k, v) -> variables.put(k, substitute(v)));
        Map<String, Object> settings = new LinkedHashMap<>();
        agent.getSettings().forEach((k, v) -> settings.put(k, substituteValue(v)));
        return agent.toBuilder()
                .name(substitute(agent.getName()))
                .subagents(subagents)
                .instruction(substitute(agent.getInstruction()))
                .tools(agent.getTools().stream().map(this::apply).toList())
                .callbacks(agent.getCallbacks().stream().map(this::apply).toList())
                .inputSchema(apply(agent.getInputSchema()))
                .outputSchema(apply(agent.getOutputSchema()))
                .contextVariables(variables)
                .model(substitute(agent.getModel()))
                .outputKey(substitute(agent.getOutputKey()))
                .description(substitute(agent.getDescription()))
                .settings(settings)
                .condition(substitute(agent.getCondition()))
                .build();
    }

    private ToolIR apply(ToolIR tool) {
        return new ToolIR(
                substitute(tool.name()),
                tool.source(),
                substitute(tool.filePath()),
                substitute(tool.code()),
                tool.errorBehavior());
    }

    private CallbackIR apply(CallbackIR callback) {
        return new CallbackIR(
                callback.phase(),
                substitute(callback.name()),
                substitute(callback.code()),
                substitute(callback.ref()),
                callback.sourceNodeId());
    }

    private SchemaIR apply(SchemaIR schema) {
        if (schema == null) {
            return null;
        }
        return new SchemaIR(
                substitute(schema.name()),
                substitute(schema.code()),
                substitute(schema.className()),
                substitute(schema.ref()),
                schema.sourceNodeId());
    }

    /// Resolves every root and rebuilds the flat agent index from the new trees.
    ///
    /// @param workflow compiled workflow, not null
    /// @return new workflow, never null
    public WorkflowIR apply(WorkflowIR workflow) {
        if (values.isEmpty()) {
            return workflow;
        }
        Map<String, AgentIR> roots = new LinkedHashMap<>();
        Map<String, AgentIR> allAgents = new LinkedHashMap<>();
        workflow.getRoots()
                .forEach(
                        (regionId, root) -> {
                            AgentIR resolved = apply(root);
                            roots.put(regionId, resolved);
                            resolved.flatten().forEach(a -> allAgents.put(a.getId(), a));
                        });
        return workflow.toBuilder().roots(roots).allAgents(allAgents).build();
    }
}
