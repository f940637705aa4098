package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code with ([object]) [body]}
 */
public final class WithStatement extends Statement {

    private Expression object;
    private Statement body;

    public WithStatement(Expression object, Statement body) {
        this.object = adopt(Objects.requireNonNull(object, "object"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Expression object() {
        return object;
    }

    public void setObject(Expression object) {
        this.object = replace(this.object, Objects.requireNonNull(object, "object"));
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    @Override
    public String type() {
        return "WithStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(object);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitWith(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitWith(this, arg);
    }
}
