package io.shortcode.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.List;
import java.util.Objects;

/**
 * Typed constant value appearing as a directive argument.
 *
 * <p>
 * Implementations are a sealed hierarchy; all variants are known at compile
 * time. Every literal can be rendered as a Jackson {@link JsonNode} so that
 * handlers may consume their arguments as JSON.
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface Literal {

    /** Literal type tag, used in argument validation messages. */
    enum Type {
        BOOL,
        STR,
        INT,
        FLOAT,
        ARRAY
    }

    /** Returns the type tag of this literal. */
    Type type();

    /** Returns this literal as a Jackson tree node. */
    JsonNode toJson();

    /** Returns the plain Java value: Boolean, String, Long, Double or List. */
    Object asJava();

    static Bool of(boolean value) {
        return value ? Bool.TRUE : Bool.FALSE;
    }

    static Str of(String value) {
        return new Str(value);
    }

    static Int of(long value) {
        return new Int(value);
    }

    static Float of(double value) {
        return new Float(value);
    }

    static Array of(Literal... elements) {
        return new Array(List.of(elements));
    }

    // ── Implementations ──

    /** {@code true} or {@code false}. */
    record Bool(boolean value) implements Literal {
        public static final Bool TRUE = new Bool(true);
        public static final Bool FALSE = new Bool(false);

        @Override
        public Type type() {
            return Type.BOOL;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.booleanNode(value);
        }

        @Override
        public Object asJava() {
            return value;
        }
    }

    /**
     * Raw text between a pair of quote delimiters. The delimiters are not part
     * of the value.
     */
    record Str(String value) implements Literal {
        public Str {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public Type type() {
            return Type.STR;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.textNode(value);
        }

        @Override
        public Object asJava() {
            return value;
        }
    }

    /** Signed 64-bit integer. */
    record Int(long value) implements Literal {
        @Override
        public Type type() {
            return Type.INT;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public Object asJava() {
            return value;
        }
    }

    /** Finite 64-bit floating point number. */
    record Float(double value) implements Literal {
        public Float {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Float literal must be finite, got: " + value);
            }
        }

        @Override
        public Type type() {
            return Type.FLOAT;
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.numberNode(value);
        }

        @Override
        public Object asJava() {
            return value;
        }
    }

    /** Ordered, possibly heterogeneous and nested, list of literals. */
    record Array(List<Literal> elements) implements Literal {
        public Array {
            elements = List.copyOf(elements);
        }

        @Override
        public Type type() {
            return Type.ARRAY;
        }

        @Override
        public JsonNode toJson() {
            ArrayNode node = JsonNodeFactory.instance.arrayNode(elements.size());
            elements.forEach(e -> node.add(e.toJson()));
            return node;
        }

        @Override
        public Object asJava() {
            return elements.stream().map(Literal::asJava).toList();
        }

        public int size() {
            return elements.size();
        }
    }
}
