package org.exprir;

/**
 * Raised when the lexer meets a character that cannot start any token.
 * <p>
 * The character is reported as a whole code point, so a supplementary character
 * such as an emoji is shown intact. The position is a UTF-16 index into the line,
 * the same unit {@link String#charAt(int)} uses.
 */
public class ExpressionLexException extends ExprIRException {

    private final String expression;
    private final int codePoint;
    private final int position;

    public ExpressionLexException(String expression, int codePoint, int position) {
        super("lex error at position " + position + ": character '" + new String(Character.toChars(codePoint)) + "'");
        this.expression = expression;
        this.codePoint = codePoint;
        this.position = position;
    }

    public String getExpression() {
        return expression;
    }

    /**
     * The offending character as text.
     */
    public String getCharacter() {
        return new String(Character.toChars(codePoint));
    }

    public int getCodePoint() {
        return codePoint;
    }

    /**
     * Zero-based UTF-16 offset of the offending character in the expression line.
     */
    public int getPosition() {
        return position;
    }
}
