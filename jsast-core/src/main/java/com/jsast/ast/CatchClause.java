package com.jsast.ast;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * A catch clause: {@code catch ([param]) [body]}. Hosts the exception variable.
 */
public final class CatchClause extends Scope {

    private Name param;
    private BlockStatement body;

    public CatchClause(Name param, BlockStatement body) {
        this.param = adopt(Objects.requireNonNull(param, "param"));
        this.body = adopt(Objects.requireNonNull(body, "body"));
    }

    public Name param() {
        return param;
    }

    public void setParam(Name param) {
        this.param = replace(this.param, Objects.requireNonNull(param, "param"));
    }

    public BlockStatement body() {
        return body;
    }

    public void setBody(BlockStatement body) {
        this.body = replace(this.body, Objects.requireNonNull(body, "body"));
    }

    @Override
    public String type() {
        return "CatchClause";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(param);
        callback.accept(body);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitCatchClause(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitCatchClause(this, arg);
    }
}
