package com.jsast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jsast.ast.*;
import com.jsast.visitor.BaseVisitor;

/**
 * Test utility that renders a tree as Jackson nodes, so expected shapes can be written as JSON.
 *
 * <p>Every node becomes {@code {"type": ..., "children": [...]}} with children in forEach order.
 * Names, literals and operators add their text. Array holes show up as JSON nulls in an
 * {@code "elements"} array instead of {@code "children"}.</p>
 */
public class JsonDump extends BaseVisitor<JsonNode> {

    private static ObjectMapper instance;

    public static synchronized ObjectMapper mapper() {
        if (instance == null) {
            instance = new ObjectMapper();
            instance.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return instance;
    }

    public static JsonNode dump(Node node) {
        return node.accept(new JsonDump());
    }

    public static String dumpString(Node node) throws Exception {
        return mapper().writeValueAsString(dump(node));
    }

    private ObjectNode base(Node node) {
        ObjectNode object = mapper().createObjectNode();
        object.put("type", node.type());
        return object;
    }

    private ObjectNode withChildren(ObjectNode object, Node node) {
        ArrayNode children = object.putArray("children");
        node.forEach(child -> children.add(visit(child)));
        return object;
    }

    @Override
    protected JsonNode defaultNode(Node node) {
        return withChildren(base(node), node);
    }

    @Override
    public JsonNode visitProgram(Program node) {
        ObjectNode object = base(node);
        object.put("filename", node.filename());
        return withChildren(object, node);
    }

    @Override
    public JsonNode visitName(Name node) {
        return base(node).put("value", node.value());
    }

    @Override
    public JsonNode visitLiteral(LiteralExpression node) {
        ObjectNode object = base(node);
        Object value = node.value();
        if (value instanceof String string) {
            object.put("value", string);
        } else if (value instanceof Number number) {
            object.put("value", number.doubleValue());
        } else if (value instanceof Boolean bool) {
            object.put("value", bool);
        } else {
            object.putNull("value");
        }
        return object.put("raw", node.raw());
    }

    @Override
    public JsonNode visitRegexp(RegexpExpression node) {
        return base(node).put("regexp", node.regexp());
    }

    @Override
    public JsonNode visitArray(ArrayExpression node) {
        ObjectNode object = base(node);
        ArrayNode elements = object.putArray("elements");
        for (Expression element : node.expressions()) {
            if (element == null) {
                elements.addNull();
            } else {
                elements.add(visit(element));
            }
        }
        return object;
    }

    @Override
    public JsonNode visitBinary(BinaryExpression node) {
        return withChildren(base(node).put("operator", node.operator()), node);
    }

    @Override
    public JsonNode visitAssignment(AssignmentExpression node) {
        return withChildren(base(node).put("operator", node.operator()), node);
    }

    @Override
    public JsonNode visitUnary(UnaryExpression node) {
        return withChildren(base(node).put("operator", node.operator()), node);
    }

    @Override
    public JsonNode visitUpdateExpression(UpdateExpression node) {
        ObjectNode object = base(node).put("operator", node.operator()).put("prefix", node.isPrefix());
        return withChildren(object, node);
    }

    @Override
    public JsonNode visitCall(CallExpression node) {
        return withChildren(base(node).put("new", node.isNew()), node);
    }

    @Override
    public JsonNode visitProperty(Property node) {
        return withChildren(base(node).put("kind", node.kind().keyword()), node);
    }
}
