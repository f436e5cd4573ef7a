package org.exprir.codegen;

import java.util.List;

/**
 * One three-address instruction. Loads carry a single operand (a formatted literal
 * or a {@code %name} reference); binary opcodes carry the left and right registers.
 */
public record IrInstruction(String destination, IrOpcode opcode, List<String> operands) {

    public IrInstruction {
        operands = List.copyOf(operands);
        int expected = opcode.isBinary() ? 2 : 1;
        if (operands.size() != expected) {
            throw new IllegalArgumentException(opcode + " expects " + expected + " operand(s), got " + operands);
        }
    }

    public static IrInstruction load(IrOpcode opcode, String destination, String operand) {
        return new IrInstruction(destination, opcode, List.of(operand));
    }

    public static IrInstruction binary(IrOpcode opcode, String destination, String left, String right) {
        return new IrInstruction(destination, opcode, List.of(left, right));
    }

    public String render() {
        if (opcode.isBinary()) {
            return destination + " = " + opcode.mnemonic() + " " + operands.get(0) + " " + operands.get(1);
        }
        return destination + " = " + operands.get(0);
    }

    @Override
    public String toString() {
        return render();
    }
}
