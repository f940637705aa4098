package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code [label]: [body]}
 */
public final class LabeledStatement extends Statement {

    private Name label;
    private Statement body;

    public LabeledStatement(Name label, Statement body) {
        this.label = adopt(Objects.requireNonNull(label, "label"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Name label() {
        return label;
    }

    public void setLabel(Name label) {
        this.label = replace(this.label, Objects.requireNonNull(label, "label"));
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    @Override
    public String type() {
        return "LabeledStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(label);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitLabeledStatement(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitLabeledStatement(this, arg);
    }
}
