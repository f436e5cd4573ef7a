package org.exprir.codegen;

import org.exprir.ast.BinaryExpr;

public enum IrOpcode {
    LOAD_LITERAL(null, "x"),
    LOAD_VARIABLE(null, "x"),
    ADD("add", "addtmp"),
    SUB("sub", "subtmp"),
    MUL("mul", "multmp"),
    DIV("div", "divtmp");

    private final String mnemonic;
    private final String registerPrefix;

    IrOpcode(String mnemonic, String registerPrefix) {
        this.mnemonic = mnemonic;
        this.registerPrefix = registerPrefix;
    }

    /**
     * Operator keyword printed after {@code =}, or null for loads.
     */
    public String mnemonic() {
        return mnemonic;
    }

    /**
     * Register name stem for the destination of this opcode, e.g. {@code addtmp}.
     */
    public String registerPrefix() {
        return registerPrefix;
    }

    public boolean isBinary() {
        return mnemonic != null;
    }

    public static IrOpcode forOperator(BinaryExpr.Operator operator) {
        return switch (operator) {
            case PLUS -> ADD;
            case MINUS -> SUB;
            case MULTIPLY -> MUL;
            case DIVIDE -> DIV;
            default -> throw new IllegalStateException("No IR opcode for operator: " + operator);
        };
    }
}
