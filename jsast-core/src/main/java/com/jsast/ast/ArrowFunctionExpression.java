package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code ([function.params]) => [function.body]}
 */
public final class ArrowFunctionExpression extends Expression {

    private ArrowFunctionNode function;

    public ArrowFunctionExpression(ArrowFunctionNode function) {
        this.function = adopt(Objects.requireNonNull(function, "function"));
    }

    public ArrowFunctionNode function() {
        return function;
    }

    public void setFunction(ArrowFunctionNode function) {
        this.function = replace(this.function, Objects.requireNonNull(function, "function"));
    }

    @Override
    public String type() {
        return "ArrowFunctionExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(function);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitArrowFunctionExpression(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitArrowFunctionExpression(this, arg);
    }
}
