package com.jsast.visitor;

import com.jsast.ast.*;

/**
 * {@link BaseVisitor} counterpart for {@link Visitor1}: every variant falls back to
 * {@link #defaultNode}, via {@link #defaultStatement}, {@link #defaultLoop} or
 * {@link #defaultExpression} where they apply.
 *
 * @param <T> result type
 * @param <A> argument type
 */
public abstract class BaseVisitor1<T, A> implements Visitor1<T, A> {

    protected abstract T defaultNode(Node node, A arg);

    protected T defaultStatement(Statement node, A arg) {
        return defaultNode(node, arg);
    }

    protected T defaultLoop(Statement node, A arg) {
        return defaultStatement(node, arg);
    }

    protected T defaultExpression(Expression node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitPrograms(Programs node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitProgram(Program node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitFunctionNode(FunctionNode node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitArrowFunctionNode(ArrowFunctionNode node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitName(Name node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitEmptyStatement(EmptyStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitBlock(BlockStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitExpressionStatement(ExpressionStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitIf(IfStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitLabeledStatement(LabeledStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitBreak(BreakStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitContinue(ContinueStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitWith(WithStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitSwitch(SwitchStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitSwitchCase(SwitchCase node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitReturn(ReturnStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitThrow(ThrowStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitTry(TryStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitCatchClause(CatchClause node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitWhile(WhileStatement node, A arg) {
        return defaultLoop(node, arg);
    }

    @Override
    public T visitDoWhile(DoWhileStatement node, A arg) {
        return defaultLoop(node, arg);
    }

    @Override
    public T visitFor(ForStatement node, A arg) {
        return defaultLoop(node, arg);
    }

    @Override
    public T visitForIn(ForInStatement node, A arg) {
        return defaultLoop(node, arg);
    }

    @Override
    public T visitFunctionDeclaration(FunctionDeclaration node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitVariableDeclaration(VariableDeclaration node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitVariableDeclarator(VariableDeclarator node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitDebugger(DebuggerStatement node, A arg) {
        return defaultStatement(node, arg);
    }

    @Override
    public T visitThis(ThisExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitArray(ArrayExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitObject(ObjectExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitProperty(Property node, A arg) {
        return defaultNode(node, arg);
    }

    @Override
    public T visitFunctionExpression(FunctionExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitArrowFunctionExpression(ArrowFunctionExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitSequence(SequenceExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitUnary(UnaryExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitBinary(BinaryExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitAssignment(AssignmentExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitUpdateExpression(UpdateExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitConditional(ConditionalExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitCall(CallExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitMember(MemberExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitIndex(IndexExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitNameExpression(NameExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitLiteral(LiteralExpression node, A arg) {
        return defaultExpression(node, arg);
    }

    @Override
    public T visitRegexp(RegexpExpression node, A arg) {
        return defaultExpression(node, arg);
    }
}
