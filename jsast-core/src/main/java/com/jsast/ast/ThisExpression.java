package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Expression of form: {@code this}
 */
public final class ThisExpression extends Expression {

    @Override
    public String type() {
        return "ThisExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitThis(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitThis(this, arg);
    }
}
