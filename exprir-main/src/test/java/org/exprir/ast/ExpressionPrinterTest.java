package org.exprir.ast;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionPrinterTest {

    @Test
    void leaves() {
        assertThat(ExpressionPrinter.print(new VariableRef("speed"))).isEqualTo("speed");
        assertThat(ExpressionPrinter.print(new NumberLiteral(3))).isEqualTo("3");
        assertThat(ExpressionPrinter.print(new NumberLiteral(2.5))).isEqualTo("2.5");
    }

    @Test
    void binary_isFullyParenthesized() {
        Expression tree = new BinaryExpr(
                new BinaryExpr(new VariableRef("a"), new NumberLiteral(1), BinaryExpr.Operator.MINUS),
                new VariableRef("b"),
                BinaryExpr.Operator.DIVIDE);
        assertThat(ExpressionPrinter.print(tree)).isEqualTo("((a - 1) / b)");
    }

    @Test
    void longLeftChain_printsWithoutRecursing() {
        Expression tree = new VariableRef("a");
        for (int i = 0; i < 100_000; i++) {
            tree = new BinaryExpr(tree, new VariableRef("b"), BinaryExpr.Operator.MINUS);
        }
        String printed = ExpressionPrinter.print(tree);
        assertThat(printed).startsWith("((((").contains("(a - b) - b)").endsWith(" - b)");
        assertThat(printed.chars().filter(c -> c == '(').count()).isEqualTo(100_000);
    }

    @Test
    void binary_rejectsMissingOperand() {
        assertThatThrownBy(() -> new BinaryExpr(null, new NumberLiteral(1), BinaryExpr.Operator.PLUS))
                .isInstanceOf(NullPointerException.class);
    }
}
