package com.jsast.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An arrow function: {@code ([params]) => [body]}.
 *
 * <p>Arrow functions are always expressions, whatever their parent. They appear in the tree
 * wrapped in an {@link ArrowFunctionExpression}.</p>
 */
public final class ArrowFunctionNode extends Scope {

    private NodeList<Name> params;
    private Statement body;

    public ArrowFunctionNode(List<Name> params, Statement body) {
        this.params = adoptAll(params);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public NodeList<Name> params() {
        return params;
    }

    public void setParams(List<Name> params) {
        this.params = replaceAll(this.params, params);
    }

    public Statement body() {
        return body;
    }

    public void setBody(Statement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    public boolean isExpression() {
        return true;
    }

    public boolean isDeclaration() {
        return false;
    }

    public boolean isAccessor() {
        return false;
    }

    @Override
    public String type() {
        return "ArrowFunctionNode";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        params.forEach(callback);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitArrowFunctionNode(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitArrowFunctionNode(this, arg);
    }
}
