package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code throw [argument];}
 */
public final class ThrowStatement extends Statement {

    private Expression argument;

    public ThrowStatement(Expression argument) {
        this.argument = adopt(Objects.requireNonNull(argument, "argument"));
    }

    public Expression argument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = replace(this.argument, Objects.requireNonNull(argument, "argument"));
    }

    @Override
    public String type() {
        return "ThrowStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(argument);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitThrow(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitThrow(this, arg);
    }
}
