package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Statement of form: {@code var [declarations];}
 */
public final class VariableDeclaration extends Statement {

    private NodeList<VariableDeclarator> declarations;

    public VariableDeclaration(List<VariableDeclarator> declarations) {
        this.declarations = adoptAll(declarations);
    }

    public NodeList<VariableDeclarator> declarations() {
        return declarations;
    }

    public void setDeclarations(List<VariableDeclarator> declarations) {
        this.declarations = replaceAll(this.declarations, declarations);
    }

    @Override
    public String type() {
        return "VariableDeclaration";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        declarations.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitVariableDeclaration(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitVariableDeclaration(this, arg);
    }
}
