package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code [object][[property]]}
 */
public final class IndexExpression extends Expression {

    private Expression object;
    private Expression property;

    public IndexExpression(Expression object, Expression property) {
        this.object = adopt(Objects.requireNonNull(object, "object"));
        this.property = adopt(Objects.requireNonNull(property, "property"));
    }

    public Expression object() {
        return object;
    }

    public void setObject(Expression object) {
        this.object = replace(this.object, Objects.requireNonNull(object, "object"));
    }

    public Expression property() {
        return property;
    }

    public void setProperty(Expression property) {
        this.property = replace(this.property, Objects.requireNonNull(property, "property"));
    }

    @Override
    public String type() {
        return "IndexExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(object);
        callback.accept(property);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitIndex(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitIndex(this, arg);
    }

    @Override
    public String toString() {
        return "IndexExpression(" + object + "[" + property + "])";
    }
}
