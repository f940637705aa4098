package com.jsast.ast;

/**
 * A visitor with one method per node variant. {@link Node#accept(Visitor)} calls the method
 * matching the node it is invoked on.
 *
 * <p>There are no default methods for the variants: a new node type breaks every visitor until
 * it handles the new type. Extend {@link com.jsast.visitor.BaseVisitor} to only handle some
 * variants.</p>
 *
 * @param <T> result type
 */
public interface Visitor<T> {

    /** Dispatches {@code node} to the method for its variant. */
    default T visit(Node node) {
        return node.accept(this);
    }

    T visitPrograms(Programs node);

    T visitProgram(Program node);

    T visitFunctionNode(FunctionNode node);

    T visitArrowFunctionNode(ArrowFunctionNode node);

    T visitName(Name node);

    T visitEmptyStatement(EmptyStatement node);

    T visitBlock(BlockStatement node);

    T visitExpressionStatement(ExpressionStatement node);

    T visitIf(IfStatement node);

    T visitLabeledStatement(LabeledStatement node);

    T visitBreak(BreakStatement node);

    T visitContinue(ContinueStatement node);

    T visitWith(WithStatement node);

    T visitSwitch(SwitchStatement node);

    T visitSwitchCase(SwitchCase node);

    T visitReturn(ReturnStatement node);

    T visitThrow(ThrowStatement node);

    T visitTry(TryStatement node);

    T visitCatchClause(CatchClause node);

    T visitWhile(WhileStatement node);

    T visitDoWhile(DoWhileStatement node);

    T visitFor(ForStatement node);

    T visitForIn(ForInStatement node);

    T visitFunctionDeclaration(FunctionDeclaration node);

    T visitVariableDeclaration(VariableDeclaration node);

    T visitVariableDeclarator(VariableDeclarator node);

    T visitDebugger(DebuggerStatement node);

    T visitThis(ThisExpression node);

    T visitArray(ArrayExpression node);

    T visitObject(ObjectExpression node);

    T visitProperty(Property node);

    T visitFunctionExpression(FunctionExpression node);

    T visitArrowFunctionExpression(ArrowFunctionExpression node);

    T visitSequence(SequenceExpression node);

    T visitUnary(UnaryExpression node);

    T visitBinary(BinaryExpression node);

    T visitAssignment(AssignmentExpression node);

    T visitUpdateExpression(UpdateExpression node);

    T visitConditional(ConditionalExpression node);

    T visitCall(CallExpression node);

    T visitMember(MemberExpression node);

    T visitIndex(IndexExpression node);

    T visitNameExpression(NameExpression node);

    T visitLiteral(LiteralExpression node);

    T visitRegexp(RegexpExpression node);
}
