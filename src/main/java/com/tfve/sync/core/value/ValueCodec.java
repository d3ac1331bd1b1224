package com.tfve.sync.core.value;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a {@link Value} to the {@code (hcl, value)} pair stored by a workspace variable, and back.
 *
 * <h2>Wire rules</h2>
 * <ul>
 *   <li>Scalars (boolean, integer, float, string) are plain variables: {@code hcl = false}.</li>
 *   <li>Null, arrays and objects are HCL variables: {@code hcl = true}, so the remote side parses them
 *       into typed collections rather than opaque strings.</li>
 *   <li>A string is sent as its literal content. Every other value is sent as compact JSON text,
 *       which is also valid HCL expression syntax.</li>
 * </ul>
 *
 * <p>Numbers are read and written as {@code BigInteger}/{@code BigDecimal} so their text survives the
 * round trip unchanged.</p>
 */
public class ValueCodec {

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private final ObjectReader reader;
    private final ObjectWriter writer;

    public ValueCodec(ObjectMapper mapper) {
        this.reader = mapper.reader()
                .with(NODES)
                .with(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.writer = mapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    public Classification classify(Value value) {
        return switch (value.kind()) {
            case BOOLEAN, INTEGER, FLOAT -> new Classification(true, false);
            case STRING -> new Classification(true, true);
            case NULL, ARRAY, OBJECT -> new Classification(false, false);
        };
    }

    public String encode(Value value) {
        if (value instanceof Value.Str s) {
            return s.value();
        }
        try {
            return writer.writeValueAsString(toJsonNode(value));
        } catch (JsonProcessingException e) {
            throw new ValueCodecException("Cannot serialize value of kind " + value.kind(), e);
        }
    }

    /**
     * Decodes a raw variable value.
     *
     * @param hcl whether the variable is stored as HCL (informational, the JSON text carries the shape)
     * @param string whether the original value was a string
     * @param rawValue the variable value as echoed by the API
     * @throws ValueCodecException when {@code rawValue} is missing or is not valid JSON where JSON is expected
     */
    public Value decode(boolean hcl, boolean string, String rawValue) {
        if (rawValue == null) {
            throw new ValueCodecException("No value to decode (hcl=" + hcl + ")");
        }
        if (string) {
            return new Value.Str(rawValue);
        }
        return fromJsonNode(readTree(rawValue));
    }

    public Value decode(Classification classification, String rawValue) {
        return decode(classification.hcl(), classification.string(), rawValue);
    }

    /**
     * Parses JSON text keeping integers and decimals exact.
     *
     * @throws ValueCodecException when the text is empty or not a single JSON value
     */
    public JsonNode readTree(String json) {
        JsonNode node;
        try {
            node = reader.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ValueCodecException("Value is not valid JSON: " + abbreviate(json), e);
        }
        if (node == null || node.isMissingNode()) {
            throw new ValueCodecException("Value is empty");
        }
        return node;
    }

    public JsonNode toJsonNode(Value value) {
        return switch (value.kind()) {
            case NULL -> NODES.nullNode();
            case BOOLEAN -> NODES.booleanNode(((Value.Bool) value).value());
            case INTEGER -> NODES.numberNode(((Value.Int) value).value());
            case FLOAT -> NODES.numberNode(((Value.Float) value).value());
            case STRING -> NODES.textNode(((Value.Str) value).value());
            case ARRAY -> {
                ArrayNode array = NODES.arrayNode();
                ((Value.Array) value).items().forEach(item -> array.add(toJsonNode(item)));
                yield array;
            }
            case OBJECT -> {
                ObjectNode object = NODES.objectNode();
                ((Value.Obj) value).members().forEach((k, v) -> object.set(k, toJsonNode(v)));
                yield object;
            }
        };
    }

    public Value fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.nul();
        }
        if (node.isBoolean()) {
            return new Value.Bool(node.booleanValue());
        }
        if (node.isIntegralNumber()) {
            return new Value.Int(node.bigIntegerValue());
        }
        if (node.isNumber()) {
            return new Value.Float(node.decimalValue());
        }
        if (node.isTextual()) {
            return new Value.Str(node.textValue());
        }
        if (node.isArray()) {
            List<Value> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJsonNode(item)));
            return new Value.Array(items);
        }
        if (node.isObject()) {
            Map<String, Value> members = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> f = fields.next();
                members.put(f.getKey(), fromJsonNode(f.getValue()));
            }
            return new Value.Obj(members);
        }
        throw new ValueCodecException("Unsupported JSON node type: " + node.getNodeType());
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
