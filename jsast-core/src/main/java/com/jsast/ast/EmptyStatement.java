package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Statement of form: {@code ;}
 */
public final class EmptyStatement extends Statement {

    @Override
    public String type() {
        return "EmptyStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitEmptyStatement(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitEmptyStatement(this, arg);
    }
}
