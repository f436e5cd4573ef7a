package org.exprir.benchmark;

import java.util.concurrent.TimeUnit;

import org.exprir.IrTranslator;
import org.exprir.ast.Expression;
import org.exprir.codegen.IrGenerator;
import org.exprir.codegen.IrProgram;
import org.exprir.parser.LiteralConversion;
import org.openjdk.jmh.annotations.*;

/**
 * Measures the cost of translating one line, split into the front end alone and
 * the whole pipeline, over a short and a deeply nested expression.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(value = 2, jvmArgsAppend = {
        "-Dexprir.literals.truncate=false"
})
@Warmup(iterations = 3)
@Measurement(iterations = 5)
public class TranslationCostBenchmark {

    @State(Scope.Thread)
    public static class SimpleState {

        final IrTranslator translator = IrTranslator.builder()
                .literalConversion(LiteralConversion.EXACT)
                .build();
        final String expression = "(1 + 2) / 3 * 5";
    }

    @State(Scope.Thread)
    public static class NestedState {

        final IrTranslator translator = IrTranslator.create();
        String expression;
        Expression tree;

        @Setup(Level.Trial)
        public void init() {
            StringBuilder sb = new StringBuilder("x0");
            for (int i = 1; i < 64; i++) {
                sb.insert(0, '(').append(i % 2 == 0 ? " + " : " * ").append("x").append(i).append(')');
            }
            expression = sb.toString();
            tree = translator.parse(expression);
        }
    }

    @Benchmark
    public IrProgram translateSimpleExpression(SimpleState state) {
        return state.translator.translate(state.expression);
    }

    @Benchmark
    public Expression parseNestedExpression(NestedState state) {
        return state.translator.parse(state.expression);
    }

    @Benchmark
    public IrProgram generateNestedExpression(NestedState state) {
        return IrGenerator.generate(state.tree);
    }

    @Benchmark
    public IrProgram translateNestedExpression(NestedState state) {
        return state.translator.translate(state.expression);
    }
}
