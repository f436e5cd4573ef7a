package org.exprir.ast;

/**
 * Double-dispatch over {@link Expression} nodes.
 *
 * @param <R> the result of visiting a node
 * @param <A> an argument threaded through the traversal
 */
public interface ExpressionVisitor<R, A> {

    R visit(VariableRef n, A arg);

    R visit(NumberLiteral n, A arg);

    R visit(BinaryExpr n, A arg);
}
