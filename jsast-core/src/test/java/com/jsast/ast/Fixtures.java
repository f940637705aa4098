package com.jsast.ast;

import java.util.Arrays;
import java.util.List;

/**
 * Small builders for hand-written trees.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static Name name(String value) {
        return new Name(value);
    }

    public static NameExpression ref(String value) {
        return new NameExpression(new Name(value));
    }

    public static LiteralExpression num(int value) {
        return new LiteralExpression((double) value, String.valueOf(value));
    }

    public static LiteralExpression str(String value) {
        return new LiteralExpression(value, "\"" + value + "\"");
    }

    public static BlockStatement block(Statement... body) {
        return new BlockStatement(List.of(body));
    }

    public static ExpressionStatement stmt(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static <N extends Node> N at(N node, int line) {
        node.setLine(line);
        return node;
    }

    /**
     * A program using every node variant at least once, wrapped in a {@link Programs} node.
     *
     * <pre>
     * function f(p) { return function () {}; }
     * var x = (y) => y;
     * ;
     * debugger;
     * this;
     * if (x) {} else ;
     * l: while (true) { break l; continue l; }
     * with ({a: 1, get b() {}}) ;
     * switch (x) { case 1: break; default: }
     * try { throw new Error("boom"); } catch (e) {} finally {}
     * do ; while (false);
     * for (var i = 0; i &lt; 10; i++) ;
     * for (k in o) ;
     * x += -1, x ? [1,,3] : /a+/g, console.log(x[0]);
     * </pre>
     */
    public static Programs allVariants() {
        FunctionNode f = new FunctionNode(name("f"), List.of(name("p")), block(
            new ReturnStatement(new FunctionExpression(new FunctionNode(null, List.of(), block())))));
        FunctionNode getter = new FunctionNode(null, List.of(), block());
        Program program = new Program("all.js", List.of(
            at(new FunctionDeclaration(f), 1),
            at(new VariableDeclaration(List.of(new VariableDeclarator(name("x"),
                new ArrowFunctionExpression(new ArrowFunctionNode(List.of(name("y")), stmt(ref("y"))))))), 2),
            new EmptyStatement(),
            new DebuggerStatement(),
            stmt(new ThisExpression()),
            new IfStatement(ref("x"), block(), new EmptyStatement()),
            new LabeledStatement(name("l"), new WhileStatement(new LiteralExpression(true, "true"),
                block(new BreakStatement(name("l")), new ContinueStatement(name("l"))))),
            new WithStatement(new ObjectExpression(List.of(
                new Property(name("a"), num(1)),
                Property.getter(name("b"), getter))), new EmptyStatement()),
            new SwitchStatement(ref("x"), List.of(
                new SwitchCase(num(1), List.of(new BreakStatement())),
                SwitchCase.defaultCase(List.of()))),
            new TryStatement(
                block(new ThrowStatement(CallExpression.newCall(ref("Error"), List.of(str("boom"))))),
                new CatchClause(name("e"), block()),
                block()),
            new DoWhileStatement(new EmptyStatement(), new LiteralExpression(false, "false")),
            new ForStatement(
                new VariableDeclaration(List.of(new VariableDeclarator(name("i"), num(0)))),
                new BinaryExpression(ref("i"), "<", num(10)),
                UpdateExpression.postfix("++", ref("i")),
                new EmptyStatement()),
            new ForInStatement(ref("k"), ref("o"), new EmptyStatement()),
            stmt(new SequenceExpression(List.of(
                new AssignmentExpression(ref("x"), "+=", new UnaryExpression("-", num(1))),
                new ConditionalExpression(ref("x"),
                    new ArrayExpression(Arrays.asList(num(1), null, num(3))),
                    new RegexpExpression("/a+/g")),
                new CallExpression(new MemberExpression(ref("console"), name("log")),
                    List.of(new IndexExpression(ref("x"), num(0)))))))));
        return new Programs(List.of(program));
    }
}
