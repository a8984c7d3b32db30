package io.flowc.core.graph;

import io.flowc.core.ir.CallbackPhase;
import java.util.Set;

/// Reserved port names on node handles.
///
/// Configuration ports sit on the agent side of `DATA` edges; every other (or missing) port
/// carries control flow.
public final class Ports {

    /// Loop marker output leading into the loop body.
    public static final String BODY = "body";

    /// Agent input for prompt, context and inline variable text.
    public static final String INSTRUCTION = "instruction";

    /// Agent input for tool sources.
    public static final String TOOLS = "tools";

    /// Agent input for the input schema source.
    public static final String INPUT_SCHEMA = "input_schema";

    /// Agent input for the output schema source.
    public static final String OUTPUT_SCHEMA = "output_schema";

    /// Agent input for context variable sources (variables, aggregators).
    public static final String CONTEXT = "context";

    /// Source port of a conditional edge; `condition:<label>` carries a label.
    public static final String CONDITION = "condition";

    private static final Set<String> CONFIGURATION_INPUTS =
            Set.of(INSTRUCTION, TOOLS, INPUT_SCHEMA, OUTPUT_SCHEMA, CONTEXT);

    private Ports() {}

    /// @param port target port of an edge, may be null
    /// @return true if the port receives configuration rather than control flow
    public static boolean isConfigurationInput(String port) {
        return port != null && CONFIGURATION_INPUTS.contains(port);
    }

    /// @param port source port of an edge, may be null
    /// @return true if the port attaches a callback node
    public static boolean isCallbackOutput(String port) {
        return CallbackPhase.fromPortName(port).isPresent();
    }

    /// @param port source port of an edge, may be null
    /// @return true for `condition` and `condition:<label>`
    public static boolean isCondition(String port) {
        return port != null && (port.equals(CONDITION) || port.startsWith(CONDITION + ":"));
    }

    /// Extracts the label of a condition port.
    ///
    /// @param port a condition port, not null
    /// @return label after the colon, or `condition` for a bare or empty label
    public static String conditionLabel(String port) {
        String label =
                port.length() > CONDITION.length() ? port.substring(CONDITION.length() + 1) : "";
        return label.isBlank() ? CONDITION : label;
    }
}
