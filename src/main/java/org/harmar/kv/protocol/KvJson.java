package org.harmar.kv.protocol;

import java.io.UncheckedIOException;
import java.util.Optional;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON form of requests and responses, one object per message:
 * <pre>
 * {"op":"set","key":"k","value":"v"}   ->  {"op":"set"}
 * {"op":"get","key":"k"}               ->  {"op":"get","value":"v"} or {"op":"get","value":null}
 * {"op":"delete","key":"k"}            ->  {"op":"delete"}
 * </pre>
 */
public final class KvJson {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private static final String OP = "op";
    private static final String KEY = "key";
    private static final String VALUE = "value";

    private KvJson() {
    }

    public static String writeRequest(KvRequest request) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(OP, request.getOperation().getWireName());
        node.put(KEY, request.getKey());
        if (request.getOperation() == Operation.SET) {
            node.put(VALUE, request.getValue());
        }
        return write(node);
    }

    public static KvRequest readRequest(String line) throws ProtocolException {
        JsonNode node = readObject(line);
        Operation op = readOperation(node);
        String key = requireText(node, KEY);

        switch (op) {
            case SET: return KvRequest.set(key, requireText(node, VALUE));
            case GET: return KvRequest.get(key);
            case DELETE: return KvRequest.delete(key);
            default: throw new ProtocolException("Unsupported operation " + op);
        }
    }

    public static String writeResponse(KvResponse response) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(OP, response.getOperation().getWireName());
        if (response.getOperation() == Operation.GET) {
            Optional<String> value = response.getValue();
            if (value.isPresent()) {
                node.put(VALUE, value.get());
            } else {
                node.putNull(VALUE);
            }
        }
        return write(node);
    }

    public static KvResponse readResponse(String line) throws ProtocolException {
        JsonNode node = readObject(line);
        Operation op = readOperation(node);

        switch (op) {
            case SET: return KvResponse.set();
            case DELETE: return KvResponse.delete();
            case GET:
                JsonNode value = node.get(VALUE);
                if (value == null || value.isNull()) {
                    return KvResponse.get(Optional.empty());
                }
                if (!value.isTextual()) {
                    throw new ProtocolException("Field 'value' must be a string or null");
                }
                return KvResponse.get(Optional.of(value.textValue()));
            default: throw new ProtocolException("Unsupported operation " + op);
        }
    }

    private static JsonNode readObject(String line) throws ProtocolException {
        JsonNode node;
        try {
            node = MAPPER.readTree(line);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ProtocolException("Expected a JSON object");
        }
        return node;
    }

    private static Operation readOperation(JsonNode node) throws ProtocolException {
        String name = requireText(node, OP);
        Operation op = Operation.fromWireName(name);
        if (op == null) {
            throw new ProtocolException("Unknown operation '" + name + "'");
        }
        return op;
    }

    private static String requireText(JsonNode node, String field) throws ProtocolException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new ProtocolException("Field '" + field + "' must be a string");
        }
        return value.textValue();
    }

    private static String write(ObjectNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }
}
