package com.jsast.ast;

/**
 * A {@link Visitor} whose methods take one extra argument, passed in through
 * {@link Node#accept(Visitor1, Object)}.
 *
 * @param <T> result type
 * @param <A> argument type
 */
public interface Visitor1<T, A> {

    /** Dispatches {@code node} to the method for its variant. */
    default T visit(Node node, A arg) {
        return node.accept(this, arg);
    }

    T visitPrograms(Programs node, A arg);

    T visitProgram(Program node, A arg);

    T visitFunctionNode(FunctionNode node, A arg);

    T visitArrowFunctionNode(ArrowFunctionNode node, A arg);

    T visitName(Name node, A arg);

    T visitEmptyStatement(EmptyStatement node, A arg);

    T visitBlock(BlockStatement node, A arg);

    T visitExpressionStatement(ExpressionStatement node, A arg);

    T visitIf(IfStatement node, A arg);

    T visitLabeledStatement(LabeledStatement node, A arg);

    T visitBreak(BreakStatement node, A arg);

    T visitContinue(ContinueStatement node, A arg);

    T visitWith(WithStatement node, A arg);

    T visitSwitch(SwitchStatement node, A arg);

    T visitSwitchCase(SwitchCase node, A arg);

    T visitReturn(ReturnStatement node, A arg);

    T visitThrow(ThrowStatement node, A arg);

    T visitTry(TryStatement node, A arg);

    T visitCatchClause(CatchClause node, A arg);

    T visitWhile(WhileStatement node, A arg);

    T visitDoWhile(DoWhileStatement node, A arg);

    T visitFor(ForStatement node, A arg);

    T visitForIn(ForInStatement node, A arg);

    T visitFunctionDeclaration(FunctionDeclaration node, A arg);

    T visitVariableDeclaration(VariableDeclaration node, A arg);

    T visitVariableDeclarator(VariableDeclarator node, A arg);

    T visitDebugger(DebuggerStatement node, A arg);

    T visitThis(ThisExpression node, A arg);

    T visitArray(ArrayExpression node, A arg);

    T visitObject(ObjectExpression node, A arg);

    T visitProperty(Property node, A arg);

    T visitFunctionExpression(FunctionExpression node, A arg);

    T visitArrowFunctionExpression(ArrowFunctionExpression node, A arg);

    T visitSequence(SequenceExpression node, A arg);

    T visitUnary(UnaryExpression node, A arg);

    T visitBinary(BinaryExpression node, A arg);

    T visitAssignment(AssignmentExpression node, A arg);

    T visitUpdateExpression(UpdateExpression node, A arg);

    T visitConditional(ConditionalExpression node, A arg);

    T visitCall(CallExpression node, A arg);

    T visitMember(MemberExpression node, A arg);

    T visitIndex(IndexExpression node, A arg);

    T visitNameExpression(NameExpression node, A arg);

    T visitLiteral(LiteralExpression node, A arg);

    T visitRegexp(RegexpExpression node, A arg);
}
