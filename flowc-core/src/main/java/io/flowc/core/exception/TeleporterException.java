package io.flowc.core.exception;

import java.io.Serial;

/// Thrown when teleporter nodes cannot be paired.
///
/// A channel must have exactly one teleporter-out and exactly one teleporter-in across the whole
/// project, and a drawn edge between teleporters must stay on one channel.
public class TeleporterException extends CompilationException {

    @Serial private static final long serialVersionUID = -2204619637390813545L;

    private final String channel;

    /// Creates exception for a channel.
    ///
    /// @param message description of the pairing failure
    /// @param channel the offending channel name, may be null
    /// @param location where the failure was detected, not null
    public TeleporterException(String message, String channel, ErrorLocation location) {
        super(message, location);
        this.channel = channel;
    }

    /// Returns the channel that failed to pair.
    ///
    /// @return channel name, may be null
    public String getChannel() {
        return channel;
    }
}
