package com.jsast.ast;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Statement of form: {@code switch ([argument]) { [cases] }}
 */
public final class SwitchStatement extends Statement {

    private Expression argument;
    private NodeList<SwitchCase> cases;

    public SwitchStatement(Expression argument, List<SwitchCase> cases) {
        this.argument = adopt(Objects.requireNonNull(argument, "argument"));
        this.cases = adoptAll(cases);
    }

    public Expression argument() {
        return argument;
    }

    public void setArgument(Expression argument) {
        this.argument = replace(this.argument, Objects.requireNonNull(argument, "argument"));
    }

    public NodeList<SwitchCase> cases() {
        return cases;
    }

    public void setCases(List<SwitchCase> cases) {
        this.cases = replaceAll(this.cases, cases);
    }

    @Override
    public String type() {
        return "SwitchStatement";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        callback.accept(argument);
        cases.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitSwitch(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitSwitch(this, arg);
    }
}
