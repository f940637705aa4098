package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code for ([left] in [right]) [body]}
 */
public final class ForInStatement extends Statement {

    private Node left;  // VariableDeclaration | Expression
    private Expression right;
    private Statement body;

    public ForInStatement(Node left, Expression right, Statement body) {
        this.left = adopt(ForStatement.requireDeclarationOrExpression(Objects.requireNonNull(left, "left"), "left"));
        this.right = adopt(Objects.requireNonNull(right, "right"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    /**
     * A {@link VariableDeclaration} or an {@link Expression}.
     */
    public Node left() {
        return left;
    }

    public void setLeft(Node left) {
        this.left = replace(this.left,
            ForStatement.requireDeclarationOrExpression(Objects.requireNonNull(left, "left"), "left"));
    }

    public Expression right() {
        return right;
    }

    public void setRight(Expression right) {
        this.right = replace(this.right, Objects.requireNonNull(right, "right"));
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    @Override
    public String type() {
        return "ForInStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(left);
        callback.accept(right);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitForIn(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitForIn(this, arg);
    }
}
