package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Statement of form: {@code break;} or {@code break [label];}
 */
public final class BreakStatement extends Statement {

    private Name label;  // Can be null

    public BreakStatement() {
        this(null);
    }

    public BreakStatement(Name label) {
        this.label = adopt(label);
    }

    public Name label() {
        return label;
    }

    public void setLabel(Name label) {
        this.label = replace(this.label, label);
    }

    @Override
    public String type() {
        return "BreakStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (label != null) {
            callback.accept(label);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitBreak(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitBreak(this, arg);
    }
}
