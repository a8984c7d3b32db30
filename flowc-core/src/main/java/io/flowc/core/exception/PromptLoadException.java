package io.flowc.core.exception;

import java.io.Serial;

/// Thrown when a prompt or context file cannot be loaded or resolved.
public class PromptLoadException extends CompilationException {

    @Serial private static final long serialVersionUID = 5090216237743329466L;

    public PromptLoadException(String message, ErrorLocation location) {
        super(message, location);
    }

    public PromptLoadException(String message, ErrorLocation location, Throwable cause) {
        super(message, location, cause);
    }
}
