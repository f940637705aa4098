package com.jsast.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.jsast.ast.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestForEach {

    private static List<Node> childrenOf(Node node) {
        List<Node> children = new ArrayList<>();
        node.forEach(children::add);
        return children;
    }

    @Test
    void testForChildrenInSourceOrder() {
        VariableDeclaration init = new VariableDeclaration(List.of(new VariableDeclarator(name("i"), num(0))));
        BinaryExpression condition = new BinaryExpression(ref("i"), "<", num(3));
        UpdateExpression update = UpdateExpression.prefix("++", ref("i"));
        EmptyStatement body = new EmptyStatement();
        ForStatement loop = new ForStatement(init, condition, update, body);

        assertEquals(List.of(init, condition, update, body), childrenOf(loop));
        // Same order on every call
        assertEquals(childrenOf(loop), childrenOf(loop));
        assertEquals(childrenOf(loop), loop.children());
    }

    @Test
    void testForSkipsAbsentParts() {
        EmptyStatement body = new EmptyStatement();
        ForStatement loop = new ForStatement(null, null, null, body);
        assertEquals(List.of(body), childrenOf(loop));
    }

    @Test
    void testReturnWithoutArgumentHasNoChildren() {
        assertTrue(childrenOf(new ReturnStatement()).isEmpty());

        NameExpression x = ref("x");
        assertEquals(List.of(x), childrenOf(new ReturnStatement(x)));
    }

    @Test
    void testArrayHoleIsKeptButSkipped() {
        LiteralExpression one = num(1);
        LiteralExpression three = num(3);
        ArrayExpression array = new ArrayExpression(Arrays.asList(one, null, three));

        assertEquals(3, array.expressions().size());
        assertFalse(array.isHole(0));
        assertTrue(array.isHole(1));
        assertNull(array.expressions().get(1));
        assertEquals(List.of(one, three), childrenOf(array));
    }

    @Test
    void testArrayWithTrailingHoles() {
        ArrayExpression array = new ArrayExpression(Arrays.asList(num(1), num(2), null, null));
        assertEquals(4, array.expressions().size());
        assertEquals(2, childrenOf(array).size());
    }

    @Test
    void testIfOrder() {
        NameExpression condition = ref("a");
        BlockStatement then = block();
        EmptyStatement otherwise = new EmptyStatement();

        assertEquals(List.of(condition, then), childrenOf(new IfStatement(condition, then)));
        IfStatement full = new IfStatement(ref("a"), block(), otherwise);
        assertEquals(3, childrenOf(full).size());
        assertSame(otherwise, childrenOf(full).get(2));
    }

    @Test
    void testBinaryLeftThenRight() {
        NameExpression left = ref("a");
        NameExpression right = ref("b");
        assertEquals(List.of(left, right), childrenOf(new BinaryExpression(left, "+", right)));
    }

    @Test
    void testTryOrder() {
        BlockStatement block = block();
        CatchClause handler = new CatchClause(name("e"), block());
        BlockStatement finalizer = block();

        assertEquals(List.of(block, handler, finalizer), childrenOf(new TryStatement(block, handler, finalizer)));

        BlockStatement other = block();
        BlockStatement onlyFinally = block();
        assertEquals(List.of(other, onlyFinally), childrenOf(new TryStatement(other, null, onlyFinally)));
    }

    @Test
    void testFunctionNameParamsBody() {
        Name fn = name("f");
        Name a = name("a");
        Name b = name("b");
        BlockStatement body = block();
        assertEquals(List.of(fn, a, b, body), childrenOf(new FunctionNode(fn, List.of(a, b), body)));

        Name c = name("c");
        BlockStatement anonymousBody = block();
        assertEquals(List.of(c, anonymousBody), childrenOf(new FunctionNode(null, List.of(c), anonymousBody)));
    }

    @Test
    void testCallCalleeThenArguments() {
        NameExpression callee = ref("f");
        LiteralExpression first = num(1);
        LiteralExpression second = str("two");
        assertEquals(List.of(callee, first, second), childrenOf(new CallExpression(callee, List.of(first, second))));
    }

    @Test
    void testSwitchCases() {
        LiteralExpression test = num(1);
        BreakStatement brk = new BreakStatement();
        SwitchCase caseOne = new SwitchCase(test, List.of(brk));
        SwitchCase otherwise = SwitchCase.defaultCase(List.of(new EmptyStatement()));
        NameExpression argument = ref("x");

        assertEquals(List.of(test, brk), childrenOf(caseOne));
        assertEquals(1, childrenOf(otherwise).size());
        assertEquals(List.of(argument, caseOne, otherwise),
            childrenOf(new SwitchStatement(argument, List.of(caseOne, otherwise))));
    }

    @Test
    void testPropertyKeyThenValue() {
        Name key = name("a");
        LiteralExpression value = num(1);
        assertEquals(List.of(key, value), childrenOf(new Property(key, value)));
    }

    @Test
    void testDoWhileBodyBeforeCondition() {
        EmptyStatement body = new EmptyStatement();
        NameExpression condition = ref("c");
        assertEquals(List.of(body, condition), childrenOf(new DoWhileStatement(body, condition)));
    }

    @Test
    void testLeavesHaveNoChildren() {
        assertTrue(childrenOf(new EmptyStatement()).isEmpty());
        assertTrue(childrenOf(new DebuggerStatement()).isEmpty());
        assertTrue(childrenOf(new ThisExpression()).isEmpty());
        assertTrue(childrenOf(name("x")).isEmpty());
        assertTrue(childrenOf(num(1)).isEmpty());
        assertTrue(childrenOf(new RegexpExpression("/x/")).isEmpty());
        assertTrue(childrenOf(new BreakStatement()).isEmpty());
        assertTrue(childrenOf(new ContinueStatement()).isEmpty());
    }
}
