package org.iconoglott.transport;

import org.iconoglott.compiler.api.CompilerErrorCode;

/**
 * An inbound message of the render protocol.
 */
public sealed interface TransportMessage {

    /**
     * A document to render.
     * @param payload The DSL source text.
     */
    record Source(String payload) implements TransportMessage {
    }

    /**
     * A liveness check, answered with a pong.
     */
    record Ping() implements TransportMessage {
    }

    /**
     * A message that could not be understood.
     * @param code Either {@link CompilerErrorCode#INVALID_MESSAGE} or {@link CompilerErrorCode#INVALID_PAYLOAD}.
     * @param reason A human-readable description.
     */
    record Invalid(CompilerErrorCode code, String reason) implements TransportMessage {
    }
}
