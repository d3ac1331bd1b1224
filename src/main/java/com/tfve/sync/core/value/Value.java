package com.tfve.sync.core.value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * =====================================================================
 * Value
 * =====================================================================
 *
 * PURPOSE
 * -------
 * Immutable JSON-shaped value read from a {@code terraform output -json}
 * document and exported as a workspace variable.
 *
 * The variant set is CLOSED: every value is exactly one of
 *
 *   Null | Bool | Int | Float | Str | Array | Obj
 *
 * and {@link #kind()} reports which one, so callers switch over
 * {@link ValueKind} instead of probing runtime types.
 *
 * NUMBERS
 * -------
 * Integers are arbitrary precision, floats keep their decimal text
 * ({@code 1.2345} stays {@code 1.2345}, never a rounded double).
 *
 * OBJECTS
 * -------
 * Member order is the document order. Nested nulls are kept as
 * {@link Null} members, never dropped.
 */
public sealed interface Value permits Value.Null, Value.Bool, Value.Int, Value.Float, Value.Str, Value.Array, Value.Obj {

    ValueKind kind();

    static Value nul() {
        return Null.INSTANCE;
    }

    static Value bool(boolean value) {
        return new Bool(value);
    }

    static Value integer(long value) {
        return new Int(BigInteger.valueOf(value));
    }

    static Value decimal(String text) {
        return new Float(new BigDecimal(text));
    }

    static Value string(String value) {
        return new Str(value);
    }

    static Value array(Value... items) {
        return new Array(Arrays.asList(items));
    }

    static Value object(Map<String, Value> members) {
        return new Obj(members);
    }

    enum Null implements Value {
        INSTANCE;

        @Override
        public ValueKind kind() {
            return ValueKind.NULL;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record Bool(boolean value) implements Value {
        @Override
        public ValueKind kind() {
            return ValueKind.BOOLEAN;
        }
    }

    record Int(BigInteger value) implements Value {
        public Int {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.INTEGER;
        }
    }

    record Float(BigDecimal value) implements Value {
        public Float {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.FLOAT;
        }
    }

    record Str(String value) implements Value {
        public Str {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public ValueKind kind() {
            return ValueKind.STRING;
        }
    }

    record Array(List<Value> items) implements Value {
        public Array {
            items = List.copyOf(items);
        }

        @Override
        public ValueKind kind() {
            return ValueKind.ARRAY;
        }
    }

    record Obj(Map<String, Value> members) implements Value {
        public Obj {
            members.values().forEach(v -> Objects.requireNonNull(v, "member value"));
            members = Collections.unmodifiableMap(new LinkedHashMap<>(members));
        }

        @Override
        public ValueKind kind() {
            return ValueKind.OBJECT;
        }
    }
}
