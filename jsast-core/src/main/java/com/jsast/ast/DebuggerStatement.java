package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Statement of form: {@code debugger;}
 */
public final class DebuggerStatement extends Statement {

    @Override
    public String type() {
        return "DebuggerStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDebugger(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitDebugger(this, arg);
    }
}
