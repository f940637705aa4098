package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [object].[property]}
 */
public final class MemberExpression extends Expression {

    private Expression object;
    private Name property;

    public MemberExpression(Expression object, Name property) {
        this.object = adopt(Objects.requireNonNull(object, "object"));
        this.property = adopt(Objects.requireNonNull(property, "property"));
    }

    public Expression object() {
        return object;
    }

    public void setObject(Expression object) {
        this.object = replace(this.object, Objects.requireNonNull(object, "object"));
    }

    public Name property() {
        return property;
    }

    public void setProperty(Name property) {
        this.property = replace(this.property, Objects.requireNonNull(property, "property"));
    }

    @Override
    public String type() {
        return "MemberExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(object);
        callback.accept(property);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitMember(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitMember(this, arg);
    }

    @Override
    public String toString() {
        return "Member(" + object + "." + property + ")";
    }
}
