package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code for ([init]; [condition]; [update]) [body]}
 */
public final class ForStatement extends Statement {

    private Node init;             // VariableDeclaration | Expression | null
    private Expression condition;  // Can be null
    private Expression update;     // Can be null
    private Statement body;

    public ForStatement(Node init, Expression condition, Expression update, Statement body) {
        this.init = adopt(init == null ? null : requireDeclarationOrExpression(init, "init"));
        this.condition = adopt(condition);
        this.update = adopt(update);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    /**
     * A {@link VariableDeclaration}, an {@link Expression}, or null.
     */
    public Node init() {
        return init;
    }

    public void setInit(Node init) {
        this.init = replace(this.init, init == null ? null : requireDeclarationOrExpression(init, "init"));
    }

    public Expression condition() {
        return condition;
    }

    public void setCondition(Expression condition) {
        this.condition = replace(this.condition, condition);
    }

    public Expression update() {
        return update;
    }

    public void setUpdate(Expression update) {
        this.update = replace(this.update, update);
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    static Node requireDeclarationOrExpression(Node node, String role) {
        if (!(node instanceof VariableDeclaration) && !(node instanceof Expression)) {
            throw new IllegalArgumentException(
                role + " must be a VariableDeclaration or an Expression, got " + node.type());
        }
        return node;
    }

    @Override
    public String type() {
        return "ForStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (init != null) {
            callback.accept(init);
        }
        if (condition != null) {
            callback.accept(condition);
        }
        if (update != null) {
            callback.accept(update);
        }
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitFor(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitFor(this, arg);
    }
}
