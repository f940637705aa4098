package com.jsast.ast;

import java.util.function.Consumer;

/**
 * Statement of form: {@code continue;} or {@code continue [label];}
 */
public final class ContinueStatement extends Statement {

    private Name label;  // Can be null

    public ContinueStatement() {
        this(null);
    }

    public ContinueStatement(Name label) {
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
        return "ContinueStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (label != null) {
            callback.accept(label);
        }
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitContinue(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitContinue(this, arg);
    }
}
