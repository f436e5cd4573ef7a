package org.exprir.codegen;

import java.util.ArrayList;
import java.util.List;

/**
 * The output of one generation pass: instructions in emission order plus the
 * register aliased by {@code %result}.
 */
public final class IrProgram {

    public static final String RESULT = "%result";

    private final List<IrInstruction> instructions;
    private final String resultRegister;

    public IrProgram(List<IrInstruction> instructions, String resultRegister) {
        if (instructions.isEmpty()) {
            throw new IllegalArgumentException("An IR program needs at least one instruction");
        }
        String last = instructions.get(instructions.size() - 1).destination();
        if (!last.equals(resultRegister)) {
            throw new IllegalArgumentException("Result register " + resultRegister
                    + " is not defined by the last instruction (" + last + ")");
        }
        this.instructions = List.copyOf(instructions);
        this.resultRegister = resultRegister;
    }

    public List<IrInstruction> getInstructions() {
        return instructions;
    }

    public String getResultRegister() {
        return resultRegister;
    }

    /**
     * All output lines, {@code %result} alias included.
     */
    public List<String> lines() {
        List<String> lines = new ArrayList<>(instructions.size() + 1);
        for (IrInstruction instruction : instructions) {
            lines.add(instruction.render());
        }
        lines.add(RESULT + " = " + resultRegister);
        return lines;
    }

    /**
     * The program as text, one instruction per line, each line terminated by {@code \n}.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (String line : lines()) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return render();
    }
}
