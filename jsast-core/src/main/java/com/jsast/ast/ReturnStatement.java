package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Statement of form: {@code return [argument];} or {@code return;}
 */
public final class ReturnStatement extends Statement {

    private Expression argument;  // Can be null

    public ReturnStatement() {
        this(null);
    }

    public ReturnStatement(Expression argument) {
        this.argument = adopt(argument);
    }

    public Expression argument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = replace(this.argument, argument);
    }

    @Override
    public String type() {
        return "ReturnStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (argument != null) {
            callback.accept(argument);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitReturn(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitReturn(this, arg);
    }
}
