package org.exprir.ast;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Renders a tree back to source form with every binary operation parenthesized,
 * so the grouping the parser chose is visible: {@code a - b - c} prints as
 * {@code ((a - b) - c)}.
 */
public class ExpressionPrinter implements ExpressionVisitor<Void, StringBuilder> {

    // subtrees still to print, interleaved with literal text fragments
    private final Deque<Object> pending = new ArrayDeque<>();

    private ExpressionPrinter() {}

    public static String print(Expression expression) {
        ExpressionPrinter printer = new ExpressionPrinter();
        StringBuilder sb = new StringBuilder();
        printer.pending.push(expression);
        while (!printer.pending.isEmpty()) {
            Object next = printer.pending.pop();
            if (next instanceof Expression node) {
                node.accept(printer, sb);
            } else {
                sb.append((String) next);
            }
        }
        return sb.toString();
    }

    @Override
    public Void visit(VariableRef n, StringBuilder sb) {
        sb.append(n.name());
        return null;
    }

    @Override
    public Void visit(NumberLiteral n, StringBuilder sb) {
        double value = n.value();
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            sb.append((long) value);
        } else {
            sb.append(value);
        }
        return null;
    }

    @Override
    public Void visit(BinaryExpr n, StringBuilder sb) {
        sb.append('(');
        pending.push(")");
        pending.push(n.right());
        pending.push(" " + n.operator().symbol() + " ");
        pending.push(n.left());
        return null;
    }
}
