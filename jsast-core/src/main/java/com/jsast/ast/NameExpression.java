package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A {@link Name} used as an expression.
 *
 * <p>Note that {@code undefined}, {@code NaN} and {@code Infinity} are name expressions,
 * not literals.</p>
 */
public final class NameExpression extends Expression {

    private Name name;

    public NameExpression(Name name) {
        this.name = adopt(Objects.requireNonNull(name, "name"));
    }

    public Name name() {
        return name;
    }

    public void setName(Name name) {
        this.name = replace(this.name, Objects.requireNonNull(name, "name"));
    }

    @Override
    public String type() {
        return "NameExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(name);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitNameExpression(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitNameExpression(this, arg);
    }

    @Override
    public String toString() {
        return "NameExpression(" + name.value() + ")";
    }
}
