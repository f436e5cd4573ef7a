package org.exprir.codegen;

import org.exprir.ast.BinaryExpr;
import org.exprir.ast.Expression;
import org.exprir.ast.ExpressionVisitor;
import org.exprir.ast.NumberLiteral;
import org.exprir.ast.VariableRef;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Lowers an expression tree into three-address IR by post-order traversal.
 * <p>
 * Every visited node defines one new register and pushes it on the evaluation
 * stack; a binary node pops its right then left operand. Left subtrees are always
 * emitted before right subtrees. The walk runs on an explicit work stack, so tree
 * depth is bounded by heap rather than by the thread stack. A generator instance
 * serves a single {@link #generate(Expression)} call.
 */
public final class IrGenerator implements ExpressionVisitor<Void, Void> {

    private final RegisterTable registers = new RegisterTable();
    private final Deque<String> stack = new ArrayDeque<>();
    private final List<IrInstruction> code = new ArrayList<>();
    private final Deque<Step> work = new ArrayDeque<>();

    /**
     * Pending work: either a subtree still to visit, or a binary node whose operands are done.
     */
    private record Step(Expression node, boolean combine) {}

    private IrGenerator() {}

    public static IrProgram generate(Expression root) {
        return new IrGenerator().run(root);
    }

    /**
     * Formats a literal the way it appears in the IR: six fractional digits, no grouping.
     */
    public static String formatLiteral(double value) {
        return String.format(Locale.ROOT, "%.6f", value);
    }

    private IrProgram run(Expression root) {
        work.push(new Step(root, false));
        while (!work.isEmpty()) {
            Step step = work.pop();
            if (step.combine()) {
                combine((BinaryExpr) step.node());
            } else {
                step.node().accept(this, null);
            }
        }
        if (stack.size() != 1) {
            throw new IllegalStateException("Evaluation stack holds " + stack.size()
                    + " registers after generation, expected exactly one: " + stack);
        }
        return new IrProgram(code, stack.pop());
    }

    @Override
    public Void visit(VariableRef n, Void arg) {
        String register = registers.allocate(IrOpcode.LOAD_VARIABLE.registerPrefix());
        emit(IrInstruction.load(IrOpcode.LOAD_VARIABLE, register, "%" + n.name()));
        return null;
    }

    @Override
    public Void visit(NumberLiteral n, Void arg) {
        String register = registers.allocate(IrOpcode.LOAD_LITERAL.registerPrefix());
        emit(IrInstruction.load(IrOpcode.LOAD_LITERAL, register, formatLiteral(n.value())));
        return null;
    }

    @Override
    public Void visit(BinaryExpr n, Void arg) {
        // popped in reverse: left subtree, right subtree, then the operator itself
        work.push(new Step(n, true));
        work.push(new Step(n.right(), false));
        work.push(new Step(n.left(), false));
        return null;
    }

    private void combine(BinaryExpr n) {
        String right = pop();
        String left = pop();

        IrOpcode opcode = IrOpcode.forOperator(n.operator());
        String register = registers.allocate(opcode.registerPrefix());
        emit(IrInstruction.binary(opcode, register, left, right));
    }

    private void emit(IrInstruction instruction) {
        code.add(instruction);
        stack.push(instruction.destination());
    }

    private String pop() {
        String register = stack.poll();
        if (register == null) {
            throw new IllegalStateException("Evaluation stack underflow");
        }
        return register;
    }
}
