// file: codec/src/main/java/io/mergekit/codec/ValueCodec.java
package io.mergekit.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mergekit.core.Value;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON &lt;-&gt; {@link Value} conversion backed by Jackson.
 * <p>
 * Mapping rules:
 *  - object  -&gt; Mapping (field order preserved)
 *  - array   -&gt; Sequence
 *  - string  -&gt; Text
 *  - number  -&gt; Num (decimals read as BigDecimal, no double rounding)
 *  - boolean -&gt; Bool
 *  - null    -&gt; Null
 * Integral numbers are written back without a fraction, so 5 stays 5.
 */
public final class ValueCodec {
    /** Integral numbers with more digits than this are written in exponent form. */
    static final int MAX_INTEGER_DIGITS = 1000;

    private final ObjectMapper mapper;
    private final JsonNodeFactory nodes = JsonNodeFactory.withExactBigDecimals(true);

    public ValueCodec() {
        this(new ObjectMapper()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ValueCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Load one configuration layer from a JSON file.
     *
     * @throws UncheckedIOException if the file cannot be read or is not valid JSON
     */
    public Value read(Path path) {
        try {
            return fromJson(mapper.readTree(path.toFile()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read config layer from " + path, e);
        }
    }

    /** Load several layers, in the given order. */
    public List<Value> readAll(List<Path> paths) {
        var out = new ArrayList<Value>(paths.size());
        for (Path p : paths) {
            out.add(read(p));
        }
        return out;
    }

    /**
     * Parse JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON
     */
    public Value parse(String json) {
        try {
            return fromJson(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /** Render a tree as JSON text, indented unless {@code compact}. */
    public String write(Value value, boolean compact) {
        try {
            JsonNode node = toJson(value);
            return compact
                    ? mapper.writer().without(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node)
                    : mapper.writer().with(SerializationFeature.INDENT_OUTPUT).writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render value as JSON", e);
        }
    }

    public Value fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Value.Null.INSTANCE;
        }
        if (node.isObject()) {
            var mapping = new Value.Mapping();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                var e = fields.next();
                mapping.put(e.getKey(), fromJson(e.getValue()));
            }
            return mapping;
        }
        if (node.isArray()) {
            var seq = new Value.Sequence();
            for (JsonNode item : node) {
                seq.add(fromJson(item));
            }
            return seq;
        }
        if (node.isNumber()) {
            return new Value.Num(node.decimalValue());
        }
        if (node.isBoolean()) {
            return Value.Bool.of(node.booleanValue());
        }
        return new Value.Text(node.asText());
    }

    public JsonNode toJson(Value value) {
        if (value == null || value instanceof Value.Null) {
            return nodes.nullNode();
        }
        if (value instanceof Value.Mapping m) {
            ObjectNode obj = nodes.objectNode();
            m.entries().forEach((k, v) -> obj.set(k, toJson(v)));
            return obj;
        }
        if (value instanceof Value.Sequence s) {
            ArrayNode arr = nodes.arrayNode();
            for (Value item : s.items()) {
                arr.add(toJson(item));
            }
            return arr;
        }
        if (value instanceof Value.Num n) {
            BigDecimal d = n.value();
            if (d.signum() == 0) {
                return nodes.numberNode(BigInteger.ZERO);
            }
            BigDecimal stripped = d.stripTrailingZeros();
            // Huge exponents such as 1e999999999 stay in exponent form.
            if (stripped.scale() <= 0 && stripped.precision() - stripped.scale() <= MAX_INTEGER_DIGITS) {
                return nodes.numberNode(stripped.toBigIntegerExact());
            }
            return nodes.numberNode(d);
        }
        if (value instanceof Value.Bool b) {
            return nodes.booleanNode(b.value());
        }
        return nodes.textNode(((Value.Text) value).value());
    }
}
