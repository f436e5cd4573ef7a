package org.exprir.parser;

import org.exprir.ExpressionParseException;
import org.exprir.ast.BinaryExpr;
import org.exprir.ast.Expression;
import org.exprir.ast.NumberLiteral;
import org.exprir.ast.VariableRef;
import org.exprir.lexer.Lexer;
import org.exprir.lexer.Token;
import org.exprir.lexer.TokenKind;

/**
 * Recursive-descent parser for one expression line.
 * <pre>
 * AddSub := MulDiv ( ('+' | '-') MulDiv )*
 * MulDiv := Atom   ( ('*' | '/') Atom )*
 * Atom   := Number | Identifier | '(' AddSub ')'
 * </pre>
 * Holds exactly one lookahead token. Binary chains are left-associative and built
 * iteratively; only parentheses recurse, at most {@link #MAX_NESTING_DEPTH} levels deep.
 */
public class Parser {

    public static final int MAX_NESTING_DEPTH = 1000;

    private final Lexer lexer;
    private final String expression;
    private final LiteralConversion literalConversion;
    private Token token;
    private int depth;

    public Parser(String expression) {
        this(expression, LiteralConversion.EXACT);
    }

    public Parser(String expression, LiteralConversion literalConversion) {
        this(new Lexer(expression), expression, literalConversion);
    }

    public Parser(Lexer lexer, String expression, LiteralConversion literalConversion) {
        this.lexer = lexer;
        this.expression = expression;
        this.literalConversion = literalConversion;
        this.token = lexer.nextToken();
    }

    /**
     * Parses the whole line: an additive expression followed by end of input.
     */
    public Expression parse() {
        Expression root = parseAddSub();
        if (!token.is(TokenKind.END_OF_FILE)) {
            throw error(token.is(TokenKind.RIGHT_PAREN)
                    ? "unmatched ')' at position " + token.position()
                    : "unexpected token " + token + " at position " + token.position() + ", expected end of input");
        }
        return root;
    }

    public Expression parseAddSub() {
        Expression node = parseMulDiv();
        while (token.is(TokenKind.PLUS) || token.is(TokenKind.MINUS)) {
            BinaryExpr.Operator op = token.is(TokenKind.PLUS) ? BinaryExpr.Operator.PLUS : BinaryExpr.Operator.MINUS;
            eat(token.kind());
            node = new BinaryExpr(node, parseMulDiv(), op);
        }
        return node;
    }

    public Expression parseMulDiv() {
        Expression node = parseAtom();
        while (token.is(TokenKind.MUL) || token.is(TokenKind.DIV)) {
            BinaryExpr.Operator op = token.is(TokenKind.MUL) ? BinaryExpr.Operator.MULTIPLY : BinaryExpr.Operator.DIVIDE;
            eat(token.kind());
            node = new BinaryExpr(node, parseAtom(), op);
        }
        return node;
    }

    public Expression parseAtom() {
        return switch (token.kind()) {
            case NUMBER -> {
                Token number = token;
                eat(TokenKind.NUMBER);
                yield new NumberLiteral(toValue(number));
            }
            case IDENTIFIER -> {
                Token identifier = token;
                eat(TokenKind.IDENTIFIER);
                yield new VariableRef(identifier.text());
            }
            case LEFT_PAREN -> {
                int open = token.position();
                if (++depth > MAX_NESTING_DEPTH) {
                    throw error("expression nested too deeply");
                }
                eat(TokenKind.LEFT_PAREN);
                Expression node = parseAddSub();
                if (!token.is(TokenKind.RIGHT_PAREN)) {
                    throw error("unmatched '(' at position " + open);
                }
                eat(TokenKind.RIGHT_PAREN);
                depth--;
                yield node;
            }
            case END_OF_FILE -> throw error("unexpected end of input, expected a number, identifier or '('");
            default -> throw error("unexpected token " + token + " at position " + token.position()
                    + ", expected a number, identifier or '('");
        };
    }

    private void eat(TokenKind expected) {
        if (!token.is(expected)) {
            throw error("unexpected token " + token + " at position " + token.position() + ", expected " + expected);
        }
        token = lexer.nextToken();
    }

    private double toValue(Token number) {
        try {
            return literalConversion.convert(number.text());
        } catch (NumberFormatException e) {
            throw new ExpressionParseException("invalid numeric literal '" + number.text() + "': " + e.getMessage(),
                    expression, number.position(), e);
        }
    }

    private ExpressionParseException error(String reason) {
        return new ExpressionParseException(reason, expression, token.position());
    }
}
