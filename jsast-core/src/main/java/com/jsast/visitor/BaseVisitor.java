package com.jsast.visitor;

import com.jsast.ast.*;

/**
 * Visitor that routes every variant to a small set of fallback methods, so subclasses override
 * only the cases they care about.
 *
 * <p>Statements go to {@link #defaultStatement} (loops to {@link #defaultLoop} first),
 * expressions to {@link #defaultExpression}, and everything ends up in {@link #defaultNode}.</p>
 *
 * @param <T> result type
 */
public abstract class BaseVisitor<T> implements Visitor<T> {

    /** Fallback for every variant not otherwise handled. */
    protected abstract T defaultNode(Node node);

    protected T defaultStatement(Statement node) {
        return defaultNode(node);
    }

    /** Fallback for while, do-while, for and for-in statements. */
    protected T defaultLoop(Statement node) {
        return defaultStatement(node);
    }

    protected T defaultExpression(Expression node) {
        return defaultNode(node);
    }

    @Override
    public T visitPrograms(Programs node) {
        return defaultNode(node);
    }

    @Override
    public T visitProgram(Program node) {
        return defaultNode(node);
    }

    @Override
    public T visitFunctionNode(FunctionNode node) {
        return defaultNode(node);
    }

    @Override
    public T visitArrowFunctionNode(ArrowFunctionNode node) {
        return defaultNode(node);
    }

    @Override
    public T visitName(Name node) {
        return defaultNode(node);
    }

    @Override
    public T visitEmptyStatement(EmptyStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitBlock(BlockStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitExpressionStatement(ExpressionStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitIf(IfStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitLabeledStatement(LabeledStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitBreak(BreakStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitContinue(ContinueStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitWith(WithStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitSwitch(SwitchStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitSwitchCase(SwitchCase node) {
        return defaultNode(node);
    }

    @Override
    public T visitReturn(ReturnStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitThrow(ThrowStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitTry(TryStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitCatchClause(CatchClause node) {
        return defaultNode(node);
    }

    @Override
    public T visitWhile(WhileStatement node) {
        return defaultLoop(node);
    }

    @Override
    public T visitDoWhile(DoWhileStatement node) {
        return defaultLoop(node);
    }

    @Override
    public T visitFor(ForStatement node) {
        return defaultLoop(node);
    }

    @Override
    public T visitForIn(ForInStatement node) {
        return defaultLoop(node);
    }

    @Override
    public T visitFunctionDeclaration(FunctionDeclaration node) {
        return defaultStatement(node);
    }

    @Override
    public T visitVariableDeclaration(VariableDeclaration node) {
        return defaultStatement(node);
    }

    @Override
    public T visitVariableDeclarator(VariableDeclarator node) {
        return defaultNode(node);
    }

    @Override
    public T visitDebugger(DebuggerStatement node) {
        return defaultStatement(node);
    }

    @Override
    public T visitThis(ThisExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitArray(ArrayExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitObject(ObjectExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitProperty(Property node) {
        return defaultNode(node);
    }

    @Override
    public T visitFunctionExpression(FunctionExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitArrowFunctionExpression(ArrowFunctionExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitSequence(SequenceExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitUnary(UnaryExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitBinary(BinaryExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitAssignment(AssignmentExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitUpdateExpression(UpdateExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitConditional(ConditionalExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitCall(CallExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitMember(MemberExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitIndex(IndexExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitNameExpression(NameExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitLiteral(LiteralExpression node) {
        return defaultExpression(node);
    }

    @Override
    public T visitRegexp(RegexpExpression node) {
        return defaultExpression(node);
    }
}
