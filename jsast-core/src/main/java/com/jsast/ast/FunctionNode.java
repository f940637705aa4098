package com.jsast.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A function, which may occur as a function expression, a function declaration, or a getter or
 * setter in an object literal. Which one it is depends on the parent node.
 */
public final class FunctionNode extends Scope {

    private Name name;  // null for anonymous functions
    private NodeList<Name> params;
    private Statement body;

    public FunctionNode(Name name, List<Name> params, Statement body) {
        this.name = adopt(name);
        this.params = adoptAll(params);
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Name name() {
        return name;
    }

    public void setName(Name name) {
        this.name = replace(this.name, name);
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
        return parent() instanceof FunctionExpression;
    }

    public boolean isDeclaration() {
        return parent() instanceof FunctionDeclaration;
    }

    public boolean isAccessor() {
        return parent() instanceof Property property && property.isAccessor();
    }

    @Override
    public String type() {
        return "FunctionNode";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        if (name != null) {
            callback.accept(name);
        }
        params.forEach(callback);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitFunctionNode(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitFunctionNode(this, arg);
    }
}
