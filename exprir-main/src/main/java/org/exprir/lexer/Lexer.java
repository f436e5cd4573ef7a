package org.exprir.lexer;

import org.exprir.ExpressionLexException;

/**
 * Pull-based scanner over a single expression line.
 * <p>
 * Each {@link #nextToken()} call scans from the cursor to the next token boundary.
 * Once the input is exhausted every further call returns {@link TokenKind#END_OF_FILE}.
 * Character classes are ASCII only.
 */
public final class Lexer {

    private final String text;
    private int pos;

    public Lexer(String text) {
        this.text = text;
        this.pos = 0;
    }

    public Token nextToken() {
        while (pos < text.length()) {
            char ch = text.charAt(pos);
            if (isWhitespace(ch)) {
                skipWhitespace();
                continue;
            }
            if (isDigit(ch)) {
                return readNumber();
            }
            if (isLetter(ch)) {
                return readIdentifier();
            }
            TokenKind kind = switch (ch) {
                case '+' -> TokenKind.PLUS;
                case '-' -> TokenKind.MINUS;
                case '*' -> TokenKind.MUL;
                case '/' -> TokenKind.DIV;
                case '(' -> TokenKind.LEFT_PAREN;
                case ')' -> TokenKind.RIGHT_PAREN;
                default -> throw new ExpressionLexException(text, text.codePointAt(pos), pos);
            };
            return Token.of(kind, pos++);
        }
        return Token.of(TokenKind.END_OF_FILE, text.length());
    }

    private Token readNumber() {
        int start = pos;
        skipDigits();
        // no check that a digit follows the dot: "12." is a complete number
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            skipDigits();
        }
        return new Token(TokenKind.NUMBER, text.substring(start, pos), start);
    }

    private Token readIdentifier() {
        int start = pos;
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            pos++;
        }
        return new Token(TokenKind.IDENTIFIER, text.substring(start, pos), start);
    }

    private void skipDigits() {
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            pos++;
        }
    }

    private void skipWhitespace() {
        while (pos < text.length() && isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    static boolean isLetter(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z');
    }

    static boolean isIdentifierPart(char ch) {
        return isLetter(ch) || isDigit(ch) || ch == '_';
    }

    static boolean isWhitespace(char ch) {
        return ch == ' ' || ch == '\t' || ch == '\n' || ch == '\u000B' || ch == '\f' || ch == '\r';
    }
}
