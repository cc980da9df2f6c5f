package com.bosdb.debugger.eval;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runtime value of the condition expression language.
 */
public sealed interface Value {

    /** Null value */
    record Null() implements Value {
        @Override
        public String toString() { return "null"; }
    }

    record Bool(boolean value) implements Value {
        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** Integer value */
    record Int(long value) implements Value {
        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** Floating point value */
    record Float(double value) implements Value {
        @Override
        public String toString() { return String.valueOf(value); }
    }

    /** String value */
    record Str(String value) implements Value {
        @Override
        public String toString() { return "'" + value + "'"; }
    }

    /** Map value; keys are property names */
    record MapValue(Map<String, Value> properties) implements Value {
        public MapValue {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("{");
            boolean first = true;
            for (Map.Entry<String, Value> entry : properties.entrySet()) {
                if (!first) sb.append(", ");
                sb.append(entry.getKey()).append(": ").append(entry.getValue());
                first = false;
            }
            return sb.append("}").toString();
        }
    }

    // Singleton instances for common values
    Value NULL = new Null();
    Value TRUE = new Bool(true);
    Value FALSE = new Bool(false);
    Value EMPTY_STRING = new Str("");

    // Factory methods
    static Value of(long value) {
        return new Int(value);
    }

    static Value of(double value) {
        return new Float(value);
    }

    static Value of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static Value of(String value) {
        if (value == null) return NULL;
        if (value.isEmpty()) return EMPTY_STRING;
        return new Str(value);
    }

    /**
     * Convert a host value (variable value, row cell, JSON node) to a {@link Value}.
     * Unknown types are represented by their string form.
     */
    static Value of(Object value) {
        return of(value, 0);
    }

    /** Nested maps below this depth are represented by their string form. */
    int MAX_MAP_DEPTH = 16;

    private static Value of(Object value, int depth) {
        if (value == null) return NULL;
        if (value instanceof Value v) return v;
        if (value instanceof Boolean b) return of(b.booleanValue());
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof BigInteger bi) return of(bi.longValue());
        if (value instanceof BigDecimal bd) {
            return bd.scale() <= 0 ? of(bd.longValue()) : of(bd.doubleValue());
        }
        if (value instanceof Number n) return of(n.doubleValue());
        if (value instanceof CharSequence cs) return of(cs.toString());
        if (value instanceof Map<?, ?> map) {
            if (depth >= MAX_MAP_DEPTH) {
                return of("{...}");
            }
            Map<String, Value> props = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                props.put(String.valueOf(entry.getKey()), of(entry.getValue(), depth + 1));
            }
            return new MapValue(props);
        }
        return of(value.toString());
    }

    // Type checking
    default boolean isNull() { return this instanceof Null; }
    default boolean isNumber() { return this instanceof Int || this instanceof Float; }
    default boolean isString() { return this instanceof Str; }

    default String typeName() {
        if (this instanceof Null) return "null";
        if (this instanceof Bool) return "boolean";
        if (this instanceof Int) return "int";
        if (this instanceof Float) return "float";
        if (this instanceof Str) return "string";
        return "map";
    }

    default boolean isTruthy() {
        if (this instanceof Null) return false;
        if (this instanceof Bool b) return b.value();
        if (this instanceof Int i) return i.value() != 0;
        if (this instanceof Float f) return f.value() != 0.0;
        if (this instanceof Str s) return !s.value().isEmpty();
        return true;
    }

    // Type coercion
    default long toLong() {
        if (this instanceof Int i) return i.value();
        if (this instanceof Float f) return (long) f.value();
        if (this instanceof Bool b) return b.value() ? 1 : 0;
        if (this instanceof Str s) {
            try {
                return Long.parseLong(s.value().trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    default double toDouble() {
        if (this instanceof Int i) return i.value();
        if (this instanceof Float f) return f.value();
        if (this instanceof Bool b) return b.value() ? 1.0 : 0.0;
        if (this instanceof Str s) {
            try {
                return Double.parseDouble(s.value().trim());
            } catch (NumberFormatException e) {
                return 0.0;
            }
        }
        return 0.0;
    }

    default String toStr() {
        if (this instanceof Null) return "";
        if (this instanceof Str s) return s.value();
        return toString();
    }

    /**
     * Plain Java form of this value, for serialization.
     */
    default Object toJava() {
        if (this instanceof Null) return null;
        if (this instanceof Bool b) return b.value();
        if (this instanceof Int i) return i.value();
        if (this instanceof Float f) return f.value();
        if (this instanceof Str s) return s.value();
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Value> entry : ((MapValue) this).properties().entrySet()) {
            out.put(entry.getKey(), entry.getValue().toJava());
        }
        return out;
    }
}
