package org.exprir;

import org.exprir.ast.Expression;
import org.exprir.ast.ExpressionPrinter;
import org.exprir.codegen.IrGenerator;
import org.exprir.codegen.IrProgram;
import org.exprir.parser.LiteralConversion;
import org.exprir.parser.Parser;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point of the pipeline: text to tokens to tree to IR.
 * <p>
 * A translator is immutable and can be shared; every {@link #translate(String)} call
 * builds its own lexer, parser and generator, so nothing carries over between lines.
 * <pre>
 * IrProgram program = IrTranslator.builder()
 *         .literalConversion(LiteralConversion.EXACT)
 *         .build()
 *         .translate("(1 + 2) / 3 * 5");
 * </pre>
 */
public final class IrTranslator {

    public static final Logger LOGGER = Logger.getLogger(IrTranslator.class.getName());

    /**
     * When {@code true}, numeric literals keep only their 32-bit integer part.
     */
    public static final String TRUNCATE_LITERALS_PROPERTY = "exprir.literals.truncate";

    private final LiteralConversion literalConversion;

    private IrTranslator(Builder builder) {
        this.literalConversion = builder.literalConversion;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A translator configured from system properties.
     */
    public static IrTranslator create() {
        return builder().build();
    }

    public LiteralConversion getLiteralConversion() {
        return literalConversion;
    }

    /**
     * Translate one line.
     *
     * @throws ExpressionLexException   if the line contains a character no token starts with
     * @throws ExpressionParseException if the tokens do not form an expression
     */
    public IrProgram translate(String expression) {
        Objects.requireNonNull(expression, "expression");
        Expression root = parse(expression);
        IrProgram program = IrGenerator.generate(root);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Generated " + program.getInstructions().size() + " instruction(s), result in "
                    + program.getResultRegister());
        }
        return program;
    }

    /**
     * Run only the front end, returning the tree.
     */
    public Expression parse(String expression) {
        Objects.requireNonNull(expression, "expression");
        Expression root = new Parser(expression, literalConversion).parse();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Parsed '" + expression + "' as " + ExpressionPrinter.print(root));
        }
        return root;
    }

    public static final class Builder {

        private LiteralConversion literalConversion = Boolean.getBoolean(TRUNCATE_LITERALS_PROPERTY)
                ? LiteralConversion.TRUNCATE_TO_INT
                : LiteralConversion.EXACT;

        private Builder() {}

        public Builder literalConversion(LiteralConversion literalConversion) {
            this.literalConversion = Objects.requireNonNull(literalConversion, "literalConversion");
            return this;
        }

        public IrTranslator build() {
            return new IrTranslator(this);
        }
    }
}
