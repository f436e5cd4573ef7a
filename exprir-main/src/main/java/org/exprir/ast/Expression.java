package org.exprir.ast;

/**
 * Root of the expression tree. The set of node kinds is closed; every visitor
 * handles all of them.
 */
public sealed interface Expression permits VariableRef, NumberLiteral, BinaryExpr {

    <R, A> R accept(ExpressionVisitor<R, A> visitor, A arg);
}
