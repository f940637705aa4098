package com.jsast.ast;

/**
 * Implements every handler of both visitor protocols by naming the variant it was called for.
 */
class RecordingVisitor implements Visitor<String>, Visitor1<String, Integer> {

    @Override
    public String visitPrograms(Programs node) {
        return "Programs";
    }

    @Override
    public String visitPrograms(Programs node, Integer arg) {
        return "Programs#" + arg;
    }

    @Override
    public String visitProgram(Program node) {
        return "Program";
    }

    @Override
    public String visitProgram(Program node, Integer arg) {
        return "Program#" + arg;
    }

    @Override
    public String visitFunctionNode(FunctionNode node) {
        return "FunctionNode";
    }

    @Override
    public String visitFunctionNode(FunctionNode node, Integer arg) {
        return "FunctionNode#" + arg;
    }

    @Override
    public String visitArrowFunctionNode(ArrowFunctionNode node) {
        return "ArrowFunctionNode";
    }

    @Override
    public String visitArrowFunctionNode(ArrowFunctionNode node, Integer arg) {
        return "ArrowFunctionNode#" + arg;
    }

    @Override
    public String visitName(Name node) {
        return "Name";
    }

    @Override
    public String visitName(Name node, Integer arg) {
        return "Name#" + arg;
    }

    @Override
    public String visitEmptyStatement(EmptyStatement node) {
        return "EmptyStatement";
    }

    @Override
    public String visitEmptyStatement(EmptyStatement node, Integer arg) {
        return "EmptyStatement#" + arg;
    }

    @Override
    public String visitBlock(BlockStatement node) {
        return "BlockStatement";
    }

    @Override
    public String visitBlock(BlockStatement node, Integer arg) {
        return "BlockStatement#" + arg;
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node) {
        return "ExpressionStatement";
    }

    @Override
    public String visitExpressionStatement(ExpressionStatement node, Integer arg) {
        return "ExpressionStatement#" + arg;
    }

    @Override
    public String visitIf(IfStatement node) {
        return "IfStatement";
    }

    @Override
    public String visitIf(IfStatement node, Integer arg) {
        return "IfStatement#" + arg;
    }

    @Override
    public String visitLabeledStatement(LabeledStatement node) {
        return "LabeledStatement";
    }

    @Override
    public String visitLabeledStatement(LabeledStatement node, Integer arg) {
        return "LabeledStatement#" + arg;
    }

    @Override
    public String visitBreak(BreakStatement node) {
        return "BreakStatement";
    }

    @Override
    public String visitBreak(BreakStatement node, Integer arg) {
        return "BreakStatement#" + arg;
    }

    @Override
    public String visitContinue(ContinueStatement node) {
        return "ContinueStatement";
    }

    @Override
    public String visitContinue(ContinueStatement node, Integer arg) {
        return "ContinueStatement#" + arg;
    }

    @Override
    public String visitWith(WithStatement node) {
        return "WithStatement";
    }

    @Override
    public String visitWith(WithStatement node, Integer arg) {
        return "WithStatement#" + arg;
    }

    @Override
    public String visitSwitch(SwitchStatement node) {
        return "SwitchStatement";
    }

    @Override
    public String visitSwitch(SwitchStatement node, Integer arg) {
        return "SwitchStatement#" + arg;
    }

    @Override
    public String visitSwitchCase(SwitchCase node) {
        return "SwitchCase";
    }

    @Override
    public String visitSwitchCase(SwitchCase node, Integer arg) {
        return "SwitchCase#" + arg;
    }

    @Override
    public String visitReturn(ReturnStatement node) {
        return "ReturnStatement";
    }

    @Override
    public String visitReturn(ReturnStatement node, Integer arg) {
        return "ReturnStatement#" + arg;
    }

    @Override
    public String visitThrow(ThrowStatement node) {
        return "ThrowStatement";
    }

    @Override
    public String visitThrow(ThrowStatement node, Integer arg) {
        return "ThrowStatement#" + arg;
    }

    @Override
    public String visitTry(TryStatement node) {
        return "TryStatement";
    }

    @Override
    public String visitTry(TryStatement node, Integer arg) {
        return "TryStatement#" + arg;
    }

    @Override
    public String visitCatchClause(CatchClause node) {
        return "CatchClause";
    }

    @Override
    public String visitCatchClause(CatchClause node, Integer arg) {
        return "CatchClause#" + arg;
    }

    @Override
    public String visitWhile(WhileStatement node) {
        return "WhileStatement";
    }

    @Override
    public String visitWhile(WhileStatement node, Integer arg) {
        return "WhileStatement#" + arg;
    }

    @Override
    public String visitDoWhile(DoWhileStatement node) {
        return "DoWhileStatement";
    }

    @Override
    public String visitDoWhile(DoWhileStatement node, Integer arg) {
        return "DoWhileStatement#" + arg;
    }

    @Override
    public String visitFor(ForStatement node) {
        return "ForStatement";
    }

    @Override
    public String visitFor(ForStatement node, Integer arg) {
        return "ForStatement#" + arg;
    }

    @Override
    public String visitForIn(ForInStatement node) {
        return "ForInStatement";
    }

    @Override
    public String visitForIn(ForInStatement node, Integer arg) {
        return "ForInStatement#" + arg;
    }

    @Override
    public String visitFunctionDeclaration(FunctionDeclaration node) {
        return "FunctionDeclaration";
    }

    @Override
    public String visitFunctionDeclaration(FunctionDeclaration node, Integer arg) {
        return "FunctionDeclaration#" + arg;
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node) {
        return "VariableDeclaration";
    }

    @Override
    public String visitVariableDeclaration(VariableDeclaration node, Integer arg) {
        return "VariableDeclaration#" + arg;
    }

    @Override
    public String visitVariableDeclarator(VariableDeclarator node) {
        return "VariableDeclarator";
    }

    @Override
    public String visitVariableDeclarator(VariableDeclarator node, Integer arg) {
        return "VariableDeclarator#" + arg;
    }

    @Override
    public String visitDebugger(DebuggerStatement node) {
        return "DebuggerStatement";
    }

    @Override
    public String visitDebugger(DebuggerStatement node, Integer arg) {
        return "DebuggerStatement#" + arg;
    }

    @Override
    public String visitThis(ThisExpression node) {
        return "ThisExpression";
    }

    @Override
    public String visitThis(ThisExpression node, Integer arg) {
        return "ThisExpression#" + arg;
    }

    @Override
    public String visitArray(ArrayExpression node) {
        return "ArrayExpression";
    }

    @Override
    public String visitArray(ArrayExpression node, Integer arg) {
        return "ArrayExpression#" + arg;
    }

    @Override
    public String visitObject(ObjectExpression node) {
        return "ObjectExpression";
    }

    @Override
    public String visitObject(ObjectExpression node, Integer arg) {
        return "ObjectExpression#" + arg;
    }

    @Override
    public String visitProperty(Property node) {
        return "Property";
    }

    @Override
    public String visitProperty(Property node, Integer arg) {
        return "Property#" + arg;
    }

    @Override
    public String visitFunctionExpression(FunctionExpression node) {
        return "FunctionExpression";
    }

    @Override
    public String visitFunctionExpression(FunctionExpression node, Integer arg) {
        return "FunctionExpression#" + arg;
    }

    @Override
    public String visitArrowFunctionExpression(ArrowFunctionExpression node) {
        return "ArrowFunctionExpression";
    }

    @Override
    public String visitArrowFunctionExpression(ArrowFunctionExpression node, Integer arg) {
        return "ArrowFunctionExpression#" + arg;
    }

    @Override
    public String visitSequence(SequenceExpression node) {
        return "SequenceExpression";
    }

    @Override
    public String visitSequence(SequenceExpression node, Integer arg) {
        return "SequenceExpression#" + arg;
    }

    @Override
    public String visitUnary(UnaryExpression node) {
        return "UnaryExpression";
    }

    @Override
    public String visitUnary(UnaryExpression node, Integer arg) {
        return "UnaryExpression#" + arg;
    }

    @Override
    public String visitBinary(BinaryExpression node) {
        return "BinaryExpression";
    }

    @Override
    public String visitBinary(BinaryExpression node, Integer arg) {
        return "BinaryExpression#" + arg;
    }

    @Override
    public String visitAssignment(AssignmentExpression node) {
        return "AssignmentExpression";
    }

    @Override
    public String visitAssignment(AssignmentExpression node, Integer arg) {
        return "AssignmentExpression#" + arg;
    }

    @Override
    public String visitUpdateExpression(UpdateExpression node) {
        return "UpdateExpression";
    }

    @Override
    public String visitUpdateExpression(UpdateExpression node, Integer arg) {
        return "UpdateExpression#" + arg;
    }

    @Override
    public String visitConditional(ConditionalExpression node) {
        return "ConditionalExpression";
    }

    @Override
    public String visitConditional(ConditionalExpression node, Integer arg) {
        return "ConditionalExpression#" + arg;
    }

    @Override
    public String visitCall(CallExpression node) {
        return "CallExpression";
    }

    @Override
    public String visitCall(CallExpression node, Integer arg) {
        return "CallExpression#" + arg;
    }

    @Override
    public String visitMember(MemberExpression node) {
        return "MemberExpression";
    }

    @Override
    public String visitMember(MemberExpression node, Integer arg) {
        return "MemberExpression#" + arg;
    }

    @Override
    public String visitIndex(IndexExpression node) {
        return "IndexExpression";
    }

    @Override
    public String visitIndex(IndexExpression node, Integer arg) {
        return "IndexExpression#" + arg;
    }

    @Override
    public String visitNameExpression(NameExpression node) {
        return "NameExpression";
    }

    @Override
    public String visitNameExpression(NameExpression node, Integer arg) {
        return "NameExpression#" + arg;
    }

    @Override
    public String visitLiteral(LiteralExpression node) {
        return "LiteralExpression";
    }

    @Override
    public String visitLiteral(LiteralExpression node, Integer arg) {
        return "LiteralExpression#" + arg;
    }

    @Override
    public String visitRegexp(RegexpExpression node) {
        return "RegexpExpression";
    }

    @Override
    public String visitRegexp(RegexpExpression node, Integer arg) {
        return "RegexpExpression#" + arg;
    }
}
