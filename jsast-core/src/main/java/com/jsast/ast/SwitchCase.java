package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Clause in a switch: {@code case [expression]: [body]}, or {@code default: [body]}
 * when the expression is null.
 */
public final class SwitchCase extends Node {

    private Expression expression;  // null for default case
    private NodeList<Statement> body;

    public SwitchCase(Expression expression, List<Statement> body) {
        this.expression = adopt(expression);
        this.body = adoptAll(body);
    }

    public static SwitchCase defaultCase(List<Statement> body) {
        return new SwitchCase(null, body);
    }

    public Expression expression() {
        return expression;
    }

    public void setExpression(Expression expression) {
        this.expression = replace(this.expression, expression);
    }

    public NodeList<Statement> body() {
        return body;
    }

    public void setBody(List<Statement> body) {
        this.body = replaceAll(this.body, body);
    }

    /** True if this is a default clause, and not a case clause. */
    public boolean isDefault() {
        return expression == null;
    }

    @Override
    public String type() {
        return "SwitchCase";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (expression != null) {
            callback.accept(expression);
        }
        body.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSwitchCase(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitSwitchCase(this, arg);
    }
}
