package io.flowc.core.graph;

import io.flowc.core.exception.CompilationException;
import io.flowc.core.exception.ErrorLocation;
import io.flowc.core.ir.CallbackPhase;
import io.flowc.core.project.ProjectSnapshot;
import io.flowc.core.project.RawEdge;
import io.flowc.core.project.RawNode;
import io.flowc.core.project.RegionFlow;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Converts raw node and edge records into typed {@link ParsedNode}/{@link ParsedEdge} values.
///
/// Each node's wire kind is mapped onto the closed {@link NodeKind} set and its data is checked
/// against the shape of that kind before the matching {@link NodePayload} record is created.
/// Node ids must be unique across all regions.
///
/// ### Data fields per kind
/// ```
/// agent           name*, model, temperature, description, output_key, instruction,
///                 tools[], before_agent_callback … after_tool_callback,
///                 input_schema, output_schema, settings{}
/// loop            name, max_iterations (>= 1)
/// teleporter-*    channel* (falls back to name)
/// variable        name*, value
/// user-input      name, trigger
/// parallel-join   name
/// custom          unit*, name, + per unit:
///                   prompt|context  file or content
///                   tool            file, code or ref
///                   callback        code or ref
///                   schema          code or ref
///                   aggregator      variables{}
/// ```
///
/// @implNote Stateless and thread-safe.
public final class FlowParser {

    private static final Logger logger = Logger.getLogger(FlowParser.class.getName());

    /// Parses every region of a project.
    ///
    /// @param project the project snapshot, not null
    /// @return parsed nodes and edges in region then declaration order, never null
    /// @throws CompilationException if a kind is unknown, a payload is malformed, or a node id
    ///     is declared twice
    public ParsedProject parse(ProjectSnapshot project) throws CompilationException {
        List<ParsedNode> nodes = new ArrayList<>();
        List<ParsedEdge> edges = new ArrayList<>();
        Map<String, String> regionByNodeId = new HashMap<>();

        for (RegionFlow region : project.getRegions()) {
            for (RawNode raw : region.nodes()) {
                String previousRegion = regionByNodeId.putIfAbsent(raw.id(), region.id());
                if (previousRegion != null) {
                    throw new CompilationException(
                            "Duplicate node id '"
                                    + raw.id()
                                    + "' (also declared in region '"
                                    + previousRegion
                                    + "')",
                            ErrorLocation.node(region.id(), raw.id()));
                }
                nodes.add(parseNode(raw, region.id()));
            }
            for (RawEdge raw : region.edges()) {
                edges.add(
                        new ParsedEdge(
                                raw.id(),
                                raw.source(),
                                raw.sourceHandle(),
                                raw.target(),
                                raw.targetHandle(),
                                region.id()));
            }
        }

        logger.fine(
                () ->
                        "Parsed project '"
                                + project.getName()
                                + "': "
                                + nodes.size()
                                + " nodes, "
                                + edges.size()
                                + " edges");
        return new ParsedProject(nodes, edges);
    }

    /// Parses one node record.
    ///
    /// @param raw the node record, not null
    /// @param regionId owning region, not null
    /// @return parsed node, never null
    /// @throws CompilationException if the kind is unknown or the payload is malformed
    public ParsedNode parseNode(RawNode raw, String regionId) throws CompilationException {
        ErrorLocation location = ErrorLocation.node(regionId, raw.id());
        NodeKind kind =
                NodeKind.fromWireName(raw.type())
                        .orElseThrow(
                                () ->
                                        new CompilationException(
                                                "Unrecognized node kind '" + raw.type() + "'",
                                                location));
        Fields fields = new Fields(raw.data(), location);
        NodePayload payload =
                switch (kind) {
                    case START -> new NodePayload.Start();
                    case END -> new NodePayload.End();
                    case PARALLEL_JOIN -> new NodePayload.ParallelJoin(fields.text("name"));
                    case AGENT -> parseAgent(fields);
                    case LOOP -> parseLoop(fields);
                    case TELEPORTER_OUT, TELEPORTER_IN -> parseTeleporter(fields);
                    case VARIABLE -> parseVariable(fields);
                    case USER_INPUT ->
                            new NodePayload.UserInput(
                                    fields.text("name"), fields.bool("trigger", false));
                    case CUSTOM -> parseCustom(fields);
                };
        return new ParsedNode(raw.id(), kind, new Position(raw.x(), raw.y()), payload, regionId);
    }

    private NodePayload.Agent parseAgent(Fields fields) throws CompilationException {
        Map<CallbackPhase, String> callbacks = new EnumMap<>(CallbackPhase.class);
        for (CallbackPhase phase : CallbackPhase.values()) {
            String ref = fields.text(phase.portName());
            if (ref != null) {
                callbacks.put(phase, ref);
            }
        }
        return new NodePayload.Agent(
                fields.requiredText("name"),
                fields.text("model"),
                fields.number("temperature"),
                fields.text("description"),
                fields.text("output_key"),
                fields.text("instruction"),
                fields.textList("tools"),
                callbacks,
                fields.text("input_schema"),
                fields.text("output_schema"),
                fields.map("settings"));
    }

    private NodePayload.Loop parseLoop(Fields fields) throws CompilationException {
        Double max = fields.number("max_iterations");
        Integer maxIterations = null;
        if (max != null) {
            if (max != Math.rint(max) || max < 1) {
                throw fields.invalid("max_iterations", "must be a positive integer");
            }
            maxIterations = max.intValue();
        }
        return new NodePayload.Loop(fields.text("name"), maxIterations);
    }

    private NodePayload.Teleporter parseTeleporter(Fields fields) throws CompilationException {
        String channel = fields.text("channel");
        if (channel == null) {
            channel = fields.text("name");
        }
        if (channel == null) {
            throw fields.invalid("channel", "is required");
        }
        return new NodePayload.Teleporter(channel);
    }

    private NodePayload.Variable parseVariable(Fields fields) throws CompilationException {
        String name = fields.requiredText("name");
        Object value = fields.data.get("value");
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw fields.invalid("value", "must be a scalar");
        }
        return new NodePayload.Variable(name, value == null ? "" : String.valueOf(value));
    }

    private NodePayload.Custom parseCustom(Fields fields) throws CompilationException {
        String unitName = fields.requiredText("unit");
        ConfigUnit unit =
                ConfigUnit.fromWireName(unitName)
                        .orElseThrow(
                                () -> fields.invalid("unit", "unknown unit '" + unitName + "'"));
        Map<String, Object> attributes = new LinkedHashMap<>(fields.data);
        attributes.remove("unit");
        attributes.remove("name");
        NodePayload.Custom custom = new NodePayload.Custom(unit, fields.text("name"), attributes);

        switch (unit) {
            case PROMPT, CONTEXT -> requireOneOf(fields, custom, "file", "content");
            case TOOL -> requireOneOf(fields, custom, "file", "code", "ref");
            case CALLBACK, SCHEMA -> requireOneOf(fields, custom, "code", "ref");
            case AGGREGATOR -> {
                if (!(fields.data.get("variables") instanceof Map<?, ?>)) {
                    throw fields.invalid("variables", "must be a mapping");
                }
            }
        }
        return custom;
    }

    private static void requireOneOf(Fields fields, NodePayload.Custom custom, String... keys)
            throws CompilationException {
        for (String key : keys) {
            if (custom.text(key).isPresent()) {
                return;
            }
        }
        throw fields.invalid(
                String.join("|", keys),
                "one of " + String.join(", ", keys) + " is required for unit '"
                        + custom.unit().wireName() + "'");
    }

    /// Typed access to a node's data with located shape errors.
    private static final class Fields {
        private final Map<String, Object> data;
        private final ErrorLocation location;

        Fields(Map<String, Object> data, ErrorLocation location) {
            this.data = data;
            this.location = location;
        }

        String text(String key) throws CompilationException {
            Object value = data.get(key);
            if (value == null) {
                return null;
            }
            if (!(value instanceof String s)) {
                throw invalid(key, "must be text");
            }
            return s.isBlank() ? null : s;
        }

        String requiredText(String key) throws CompilationException {
            String value = text(key);
            if (value == null) {
                throw invalid(key, "is required");
            }
            return value;
        }

        Double number(String key) throws CompilationException {
            Object value = data.get(key);
            if (value == null) {
                return null;
            }
            if (!(value instanceof Number n)) {
                throw invalid(key, "must be a number");
            }
            return n.doubleValue();
        }

        boolean bool(String key, boolean defaultValue) throws CompilationException {
            Object value = data.get(key);
            if (value == null) {
                return defaultValue;
            }
            if (!(value instanceof Boolean b)) {
                throw invalid(key, "must be true or false");
            }
            return b;
        }

        List<String> textList(String key) throws CompilationException {
            Object value = data.get(key);
            if (value == null) {
                return List.of();
            }
            if (!(value instanceof List<?> list)) {
                throw invalid(key, "must be a list");
            }
            List<String> result = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof String s) || s.isBlank()) {
                    throw invalid(key, "must contain only non-blank text");
                }
                result.add(s);
            }
            return result;
        }

        Map<String, Object> map(String key) throws CompilationException {
            Object value = data.get(key);
            if (value == null) {
                return Map.of();
            }
            if (!(value instanceof Map<?, ?> map)) {
                throw invalid(key, "must be a mapping");
            }
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), v));
            return Collections.unmodifiableMap(result);
        }

        CompilationException invalid(String key, String problem) {
            return new CompilationException("Field '" + key + "' " + problem, location);
        }
    }
}
