package org.exprir.lexer;

/**
 * A single lexeme. {@code text} is only present for {@link TokenKind#NUMBER} and
 * {@link TokenKind#IDENTIFIER}; {@code position} is the zero-based offset of its first character.
 */
public record Token(TokenKind kind, String text, int position) {

    public static Token of(TokenKind kind, int position) {
        return new Token(kind, null, position);
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return text == null ? kind.name() : kind.name() + "(" + text + ")";
    }
}
