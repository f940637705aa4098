package com.jsast.ast;

import java.util.List;
import java.util.function.Consumer;

/**
 * Expression of form: {@code { [properties] }}
 */
public final class ObjectExpression extends Expression {

    private NodeList<Property> properties;

    public ObjectExpression(List<Property> properties) {
        this.properties = adoptAll(properties);
    }

    public NodeList<Property> properties() {
        return properties;
    }

    public void setProperties(List<Property> properties) {
        this.properties = replaceAll(this.properties, properties);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }

    @Override
    public void forEach(Consumer<? super Node> callback) {
        properties.forEach(callback);
    }

    @Override
    public <T> T accept(Visitor<T> visitor) {
        return visitor.visitObject(this);
    }

    @Override
    public <T, A> T accept(Visitor1<T, A> visitor, A arg) {
        return visitor.visitObject(this, arg);
    }
}
