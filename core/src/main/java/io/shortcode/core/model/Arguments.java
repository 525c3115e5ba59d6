package io.shortcode.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.shortcode.core.error.InvalidArgumentException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Handler-facing view over the arguments of one directive call.
 *
 * <p>
 * The engine performs no arity or type checking; handlers validate what they
 * expect through the {@code require*} and {@code optional*} accessors, which
 * throw {@link InvalidArgumentException} with a descriptive message.
 *
 * <p>
 * {@link #list()} keeps every argument in source order. The by-name accessors
 * see duplicates resolved according to the {@link DuplicateArgumentPolicy}.
 */
public final class Arguments {

    private static final Arguments EMPTY = new Arguments(List.of(), Map.of());

    private final List<Argument> list;
    private final Map<String, Literal> byName;

    private Arguments(List<Argument> list, Map<String, Literal> byName) {
        this.list = list;
        this.byName = byName;
    }

    /**
     * Builds the view for the given source-ordered arguments.
     *
     * @throws InvalidArgumentException if {@code policy} is {@code REJECT} and a
     *                                  name occurs more than once
     */
    public static Arguments of(List<Argument> arguments, DuplicateArgumentPolicy policy) {
        Objects.requireNonNull(policy, "policy must not be null");
        if (arguments == null || arguments.isEmpty()) {
            return EMPTY;
        }
        Map<String, Literal> byName = new LinkedHashMap<>();
        for (Argument arg : arguments) {
            if (!byName.containsKey(arg.name())) {
                byName.put(arg.name(), arg.value());
                continue;
            }
            switch (policy) {
                case LAST_WINS -> byName.put(arg.name(), arg.value());
                case FIRST_WINS -> {
                    // keep the first occurrence
                }
                case REJECT -> throw InvalidArgumentException.duplicate(arg.name());
            }
        }
        return new Arguments(List.copyOf(arguments), Collections.unmodifiableMap(byName));
    }

    public static Arguments of(List<Argument> arguments) {
        return of(arguments, DuplicateArgumentPolicy.LAST_WINS);
    }

    public static Arguments empty() {
        return EMPTY;
    }

    /** All arguments in source order, duplicates included. */
    public List<Argument> list() {
        return list;
    }

    /** Distinct argument names in order of first occurrence. */
    public Set<String> names() {
        return byName.keySet();
    }

    public boolean has(String name) {
        return byName.containsKey(name);
    }

    public Optional<Literal> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public int size() {
        return byName.size();
    }

    public boolean isEmpty() {
        return byName.isEmpty();
    }

    // ── Typed accessors ──

    public String requireString(String name) {
        return expect(require(name), name, Literal.Str.class, Literal.Type.STR).value();
    }

    public long requireInt(String name) {
        return expect(require(name), name, Literal.Int.class, Literal.Type.INT).value();
    }

    /** Accepts an {@code Int} literal as well, widened to {@code double}. */
    public double requireFloat(String name) {
        return toDouble(require(name), name);
    }

    public boolean requireBool(String name) {
        return expect(require(name), name, Literal.Bool.class, Literal.Type.BOOL).value();
    }

    public List<Literal> requireArray(String name) {
        return expect(require(name), name, Literal.Array.class, Literal.Type.ARRAY).elements();
    }

    public String optionalString(String name, String defaultValue) {
        Literal value = byName.get(name);
        return value == null ? defaultValue : expect(value, name, Literal.Str.class, Literal.Type.STR).value();
    }

    public long optionalInt(String name, long defaultValue) {
        Literal value = byName.get(name);
        return value == null ? defaultValue : expect(value, name, Literal.Int.class, Literal.Type.INT).value();
    }

    public double optionalFloat(String name, double defaultValue) {
        Literal value = byName.get(name);
        return value == null ? defaultValue : toDouble(value, name);
    }

    public boolean optionalBool(String name, boolean defaultValue) {
        Literal value = byName.get(name);
        return value == null ? defaultValue : expect(value, name, Literal.Bool.class, Literal.Type.BOOL).value();
    }

    /** Arguments as a JSON object, one field per distinct name. */
    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        byName.forEach((name, value) -> node.set(name, value.toJson()));
        return node;
    }

    private Literal require(String name) {
        Literal value = byName.get(name);
        if (value == null) {
            throw InvalidArgumentException.missing(name);
        }
        return value;
    }

    private static double toDouble(Literal value, String name) {
        if (value instanceof Literal.Float f) {
            return f.value();
        }
        if (value instanceof Literal.Int i) {
            return i.value();
        }
        throw InvalidArgumentException.wrongType(name, Literal.Type.FLOAT, value);
    }

    private static <T extends Literal> T expect(Literal value, String name, Class<T> type, Literal.Type expected) {
        if (!type.isInstance(value)) {
            throw InvalidArgumentException.wrongType(name, expected, value);
        }
        return type.cast(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Arguments that)) return false;
        return list.equals(that.list);
    }

    @Override
    public int hashCode() {
        return list.hashCode();
    }

    @Override
    public String toString() {
        return "Arguments" + list;
    }
}
