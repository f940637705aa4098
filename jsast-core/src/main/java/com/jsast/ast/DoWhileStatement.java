package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code do [body] while ([condition]);}
 */
public final class DoWhileStatement extends Statement {

    private Statement body;
    private Expression condition;

    public DoWhileStatement(Statement body, Expression condition) {
        this.body = adopt(Objects.requireNonNull(body, "body"));
        this.condition = adopt(Objects.requireNonNull(condition, "condition"));
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = replace(this.condition, Objects.requireNonNull(condition, "condition"));
    }

    @Override
    public String type() {
        return "DoWhileStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(body);
        callback.accept(condition);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitDoWhile(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitDoWhile(this, arg);
    }
}
