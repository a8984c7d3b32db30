package io.flowc.core.exception;

import java.io.Serial;

/// Thrown when a tool file or tool reference cannot be loaded or resolved.
public class ToolLoadException extends CompilationException {

    @Serial private static final long serialVersionUID = -1766045112093818047L;

    public ToolLoadException(String message, ErrorLocation location) {
        super(message, location);
    }

    public ToolLoadException(String message, ErrorLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
