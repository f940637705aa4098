package com.jsast.ast;

import java.util.function.Consumer;

/**
 * A literal string, number, boolean or null.
 *
 * <p>Note that {@code undefined}, {@code NaN} and {@code Infinity} are {@link NameExpression}s,
 * not literals.</p>
 */
public final class LiteralExpression extends Expression {

    private Object value;  // String | Number | Boolean | null
    private String raw;

    public LiteralExpression(Object value) {
        this(value, null);
    }

    public LiteralExpression(Object value, String raw) {
        this.value = requireLiteralValue(value);
        this.raw = raw;
    }

    /** A {@link String}, {@link Number}, {@link Boolean}, or null. */
    public Object value() {
        return value;
    }

    public void setValue(Object value) {
        this.value = requireLiteralValue(value);
    }

    /** The verbatim source text of the literal, or null if not known. */
    public String raw() {
        return raw;
    }

    public void setRaw(String raw) {
        this.raw = raw;
    }

    public boolean isString() {
        return value instanceof String;
    }

    public boolean isNumber() {
        return value instanceof Number;
    }

    public boolean isBool() {
        return value instanceof Boolean;
    }

    public boolean isNull() {
        return value == null;
    }

    public String stringValue() {
        return as(String.class);
    }

    public Number numberValue() {
        return as(Number.class);
    }

    public Boolean boolValue() {
        return as(Boolean.class);
    }

    /**
     * The value converted to a string, as used for property names. Integral numbers have no
     * fraction, so the key {@code 1} names the property {@code "1"}.
     */
    public String toName() {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            if (d == Math.rint(d) && Math.abs(d) < 1e21) {
                return Long.toString((long) d);
            }
            if (value instanceof Double || value instanceof Float) {
                return Double.toString(d);
            }
        }
        return String.valueOf(value);
    }

    private <V> V as(Class<V> type) {
        if (value != null && !type.isInstance(value)) {
            throw new IllegalStateException(
                "literal " + this + " is not a " + type.getSimpleName());
        }
        return type.cast(value);
    }

    private static Object requireLiteralValue(Object value) {
        if (value != null && !(value instanceof String) && !(value instanceof Number) && !(value instanceof Boolean)) {
            throw new IllegalArgumentException("unsupported literal value type: " + value.getClass().getName());
        }
        return value;
    }

    @Override
    public String type() {
        return "LiteralExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitLiteral(this, arg);
    }

    @Override
    public String toString() {
        return "Lit(" + value + ")";
    }
}
