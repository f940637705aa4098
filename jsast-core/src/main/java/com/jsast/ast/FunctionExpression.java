package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Expression of form: {@code function [function.name]([function.params]) { [function.body] }}
 */
public final class FunctionExpression extends Expression {

    private FunctionNode function;

    public FunctionExpression(FunctionNode function) {
        this.function = adopt(Objects.requireNonNull(function, "function"));
    }

    public FunctionNode function() {
        return function;
    }

    public void setFunction(FunctionNode function) {
        this.function = replace(this.function, Objects.requireNonNull(function, "function"));
    }

    @Override
    public String type() {
        return "FunctionExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(function);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitFunctionExpression(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitFunctionExpression(this, arg);
    }
}
