package com.jsast.ast;

/**
 * Superclass for all nodes that are expressions.
 */
public abstract sealed class Expression extends Node permits
    ThisExpression,
    ArrayExpression,
    ObjectExpression,
    FunctionExpression,
    ArrowFunctionExpression,
    SequenceExpression,
    UnaryExpression,
    BinaryExpression,
    AssignmentExpression,
    UpdateExpression,
    ConditionalExpression,
    CallExpression,
    MemberExpression,
    IndexExpression,
    NameExpression,
    LiteralExpression,
    RegexpExpression {
}
