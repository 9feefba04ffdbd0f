package org.iconoglott.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.iconoglott.compiler.api.CompilerErrorCode;
import org.iconoglott.compiler.api.RenderResult;
import org.iconoglott.compiler.api.Severity;
import org.iconoglott.compiler.diagnostics.Diagnostic;
import org.iconoglott.compiler.diagnostics.RecoveryAction;

import java.util.List;

/**
 * Encodes and decodes the JSON messages of the render protocol.
 * <p>
 * Inbound: <code>{"type":"source","payload":"..."}</code> and <code>{"type":"ping"}</code>.
 * Text that is not a JSON object is taken as raw source.
 * Outbound: <code>render</code>, <code>error</code> and <code>pong</code> messages.
 */
public class MessageCodec {

    private static final String TYPE = "type";

    private final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Decodes an inbound message.
     * @param text The raw text received from the peer.
     * @return The decoded message. Never {@code null}.
     */
    public TransportMessage decode(String text) {
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return new TransportMessage.Source(text);
        }
        if (node == null || !node.isObject()) {
            return new TransportMessage.Source(text);
        }

        String type = node.path(TYPE).asText("");
        switch (type) {
            case "source":
                JsonNode payload = node.get("payload");
                if (payload == null || !payload.isTextual()) {
                    return new TransportMessage.Invalid(CompilerErrorCode.INVALID_PAYLOAD,
                            "A source message needs a text payload.");
                }
                return new TransportMessage.Source(payload.asText());
            case "ping":
                return new TransportMessage.Ping();
            default:
                return new TransportMessage.Invalid(CompilerErrorCode.INVALID_MESSAGE,
                        "Unknown message type: '" + type + "'");
        }
    }

    /**
     * @param result A rendered document.
     * @return <code>{"type":"render","output":...,"errors":[...]}</code>
     */
    public String encodeRender(RenderResult result) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put(TYPE, "render");
        message.put("output", result.document());
        message.set("errors", diagnostics(result.diagnostics()));
        return write(message);
    }

    /**
     * @param text The error message.
     * @param errors The diagnostics explaining it.
     * @return <code>{"type":"error","message":...,"errors":[...]}</code>
     */
    public String encodeError(String text, List<Diagnostic> errors) {
        ObjectNode message = objectMapper.createObjectNode();
        message.put(TYPE, "error");
        message.put("message", text);
        message.set("errors", diagnostics(errors));
        return write(message);
    }

    /**
     * @param invalid A message that could not be understood.
     * @return An error message carrying one transport diagnostic.
     */
    public String encodeInvalid(TransportMessage.Invalid invalid) {
        Diagnostic diagnostic = new Diagnostic(invalid.code(), invalid.reason(), 0, 0,
                Severity.ERROR, null, RecoveryAction.SKIP);
        return encodeError(invalid.reason(), List.of(diagnostic));
    }

    /**
     * @return <code>{"type":"pong"}</code>
     */
    public String encodePong() {
        ObjectNode message = objectMapper.createObjectNode();
        message.put(TYPE, "pong");
        return write(message);
    }

    /**
     * Converts a diagnostic to its wire form:
     * <code>{code, category, message, line, column, severity, context?}</code>.
     * @param diagnostic The diagnostic.
     * @return The JSON object.
     */
    public ObjectNode diagnostic(Diagnostic diagnostic) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("code", diagnostic.code().code());
        node.put("category", diagnostic.category().label());
        node.put("message", diagnostic.message());
        node.put("line", diagnostic.line());
        node.put("column", diagnostic.column());
        node.put("severity", diagnostic.severity().label());
        if (diagnostic.context() != null) {
            node.put("context", diagnostic.context());
        }
        return node;
    }

    private ArrayNode diagnostics(List<Diagnostic> diagnostics) {
        ArrayNode array = objectMapper.createArrayNode();
        for (Diagnostic diagnostic : diagnostics) {
            array.add(diagnostic(diagnostic));
        }
        return array;
    }

    private String write(ObjectNode message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode " + message.path(TYPE).asText() + " message", e);
        }
    }
}
