package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code function [function.name]([function.params]) { [function.body] }}
 */
public final class FunctionDeclaration extends Statement {

    private FunctionNode function;

    public FunctionDeclaration(FunctionNode function) {
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
        return "FunctionDeclaration";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(function);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitFunctionDeclaration(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitFunctionDeclaration(this, arg);
    }
}
