package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Property initializer {@code [key]: [value]}, getter {@code get [key] [value]}, or setter
 * {@code set [key] [value]}.
 *
 * <p>For getters and setters the value is a {@link FunctionNode}, otherwise it is an
 * {@link Expression}.</p>
 */
public final class Property extends Node {

    private Node key;    // Name | LiteralExpression
    private Node value;  // FunctionNode for accessors, Expression otherwise
    private PropertyKind kind;

    public Property(Node key, Expression value) {
        this(key, value, PropertyKind.INIT);
    }

    public Property(Node key, Node value, PropertyKind kind) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.key = adopt(requireKey(key));
        this.value = adopt(requireValue(value, kind));
    }

    public static Property getter(Node key, FunctionNode function) {
        return new Property(key, function, PropertyKind.GET);
    }

    public static Property setter(Node key, FunctionNode function) {
        return new Property(key, function, PropertyKind.SET);
    }

    /**
     * A {@link Name} or {@link LiteralExpression}. Use {@link #nameString()} for the name as a string.
     */
    public Node key() {
        return key;
    }

    public void setKey(Node key) {
        this.key = replace(this.key, requireKey(key));
    }

    public Node value() {
        return value;
    }

    public void setValue(Node value) {
        this.value = replace(this.value, requireValue(value, kind));
    }

    public PropertyKind kind() {
        return kind;
    }

    /**
     * Changes the kind. The current value must suit the new kind.
     */
    public void setKind(PropertyKind kind) {
        requireValue(value, Objects.requireNonNull(kind, "kind"));
        this.kind = kind;
    }

    public boolean isInit() {
        return kind == PropertyKind.INIT;
    }

    public boolean isGetter() {
        return kind == PropertyKind.GET;
    }

    public boolean isSetter() {
        return kind == PropertyKind.SET;
    }

    public boolean isAccessor() {
        return kind.isAccessor();
    }

    /**
     * The property name: the identifier text, or the literal value converted to a string.
     */
    public String nameString() {
        if (key instanceof Name name) {
            return name.value();
        }
        return ((LiteralExpression) key).toName();
    }

    /**
     * The value as a function. Only valid for getters and setters.
     */
    public FunctionNode function() {
        if (!(value instanceof FunctionNode function)) {
            throw new IllegalStateException(kind.keyword() + " property has no function value");
        }
        return function;
    }

    /**
     * The value as an expression. Only valid for plain properties.
     */
    public Expression expression() {
        if (!(value instanceof Expression expression)) {
            throw new IllegalStateException(kind.keyword() + " property has no expression value");
        }
        return expression;
    }

    private static Node requireKey(Node key) {
        Objects.requireNonNull(key, "key");
        if (!(key instanceof Name) && !(key instanceof LiteralExpression)) {
            throw new IllegalArgumentException("property key must be a Name or a LiteralExpression, got " + key.type());
        }
        return key;
    }

    private static Node requireValue(Node value, PropertyKind kind) {
        Objects.requireNonNull(value, "value");
        if (kind.isAccessor() && !(value instanceof FunctionNode)) {
            throw new IllegalArgumentException(kind.keyword() + " property value must be a FunctionNode, got " + value.type());
        }
        if (!kind.isAccessor() && !(value instanceof Expression)) {
            throw new IllegalArgumentException("init property value must be an Expression, got " + value.type());
        }
        return value;
    }

    @Override
    public String type() {
        return "Property";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(key);
        callback.accept(value);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitProperty(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitProperty(this, arg);
    }
}
