package org.exprir.lexer;

import org.exprir.ExpressionLexException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LexerTest {

    private static List<Token> tokenize(String text) {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = lexer.nextToken();
            tokens.add(token);
        } while (!token.is(TokenKind.END_OF_FILE));
        return tokens;
    }

    private static List<TokenKind> kinds(String text) {
        List<TokenKind> kinds = new ArrayList<>();
        for (Token token : tokenize(text)) {
            kinds.add(token.kind());
        }
        return kinds;
    }

    @Test
    void operatorsAndParens_mapToSingleCharacterKinds() {
        assertThat(kinds("+-*/()")).containsExactly(
                TokenKind.PLUS, TokenKind.MINUS, TokenKind.MUL, TokenKind.DIV,
                TokenKind.LEFT_PAREN, TokenKind.RIGHT_PAREN, TokenKind.END_OF_FILE);
    }

    @Test
    void whitespace_producesNoTokens() {
        assertThat(kinds(" \t 1 \r\n +\f2 ")).containsExactly(
                TokenKind.NUMBER, TokenKind.PLUS, TokenKind.NUMBER, TokenKind.END_OF_FILE);
        assertThat(kinds("   ")).containsExactly(TokenKind.END_OF_FILE);
        assertThat(kinds("")).containsExactly(TokenKind.END_OF_FILE);
    }

    @Test
    void number_integerAndFraction() {
        List<Token> tokens = tokenize("42 3.25 7.");
        assertThat(tokens.get(0)).isEqualTo(new Token(TokenKind.NUMBER, "42", 0));
        assertThat(tokens.get(1)).isEqualTo(new Token(TokenKind.NUMBER, "3.25", 3));
        // the dot is consumed even when no digit follows it
        assertThat(tokens.get(2)).isEqualTo(new Token(TokenKind.NUMBER, "7.", 8));
    }

    @Test
    void number_stopsAtSecondDot() {
        Lexer lexer = new Lexer("1.2.3");
        assertThat(lexer.nextToken().text()).isEqualTo("1.2");
        assertThatThrownBy(lexer::nextToken)
                .isInstanceOf(ExpressionLexException.class)
                .satisfies(e -> assertThat(((ExpressionLexException) e).getPosition()).isEqualTo(3));
    }

    @Test
    void identifier_lettersDigitsUnderscores() {
        List<Token> tokens = tokenize("foo_1bar x2");
        assertThat(tokens.get(0)).isEqualTo(new Token(TokenKind.IDENTIFIER, "foo_1bar", 0));
        assertThat(tokens.get(1)).isEqualTo(new Token(TokenKind.IDENTIFIER, "x2", 9));
    }

    @Test
    void identifier_gluedToNumberSplits() {
        List<Token> tokens = tokenize("2x");
        assertThat(tokens.get(0)).isEqualTo(new Token(TokenKind.NUMBER, "2", 0));
        assertThat(tokens.get(1)).isEqualTo(new Token(TokenKind.IDENTIFIER, "x", 1));
    }

    @Test
    void operatorTokens_carryNoText() {
        assertThat(new Lexer("+").nextToken()).isEqualTo(new Token(TokenKind.PLUS, null, 0));
        assertThat(new Lexer("abc").nextToken().text()).isEqualTo("abc");
    }

    @Test
    void endOfFile_isReturnedRepeatedly() {
        Lexer lexer = new Lexer("a");
        assertThat(lexer.nextToken().kind()).isEqualTo(TokenKind.IDENTIFIER);
        for (int i = 0; i < 3; i++) {
            assertThat(lexer.nextToken().kind()).isEqualTo(TokenKind.END_OF_FILE);
        }
        assertThat(lexer.nextToken().position()).isEqualTo(1);
    }

    // ── Errors ────────────────────────────────────────────────────────────

    @Test
    void unknownCharacter_reportsCharacterAndOffset() {
        Lexer lexer = new Lexer("1 $ 2");
        assertThat(lexer.nextToken().kind()).isEqualTo(TokenKind.NUMBER);
        assertThatThrownBy(lexer::nextToken)
                .isInstanceOf(ExpressionLexException.class)
                .hasMessage("lex error at position 2: character '$'")
                .satisfies(e -> {
                    ExpressionLexException le = (ExpressionLexException) e;
                    assertThat(le.getCharacter()).isEqualTo("$");
                    assertThat(le.getCodePoint()).isEqualTo('$');
                    assertThat(le.getPosition()).isEqualTo(2);
                    assertThat(le.getExpression()).isEqualTo("1 $ 2");
                });
    }

    @Test
    void leadingDotAndUnderscore_areNotTokenStarts() {
        assertThatThrownBy(() -> tokenize(".5"))
                .isInstanceOf(ExpressionLexException.class)
                .hasMessageContaining("'.'");
        assertThatThrownBy(() -> tokenize("_a"))
                .isInstanceOf(ExpressionLexException.class)
                .hasMessageContaining("position 0");
    }

    @Test
    void supplementaryCharacter_isReportedWhole() {
        String line = "a + \uD83D\uDE00";
        assertThatThrownBy(() -> tokenize(line))
                .isInstanceOf(ExpressionLexException.class)
                .hasMessage("lex error at position 4: character '\uD83D\uDE00'")
                .satisfies(e -> {
                    ExpressionLexException le = (ExpressionLexException) e;
                    assertThat(le.getCodePoint()).isEqualTo(0x1F600);
                    assertThat(le.getCharacter()).isEqualTo("\uD83D\uDE00");
                });
    }

    @Test
    void nonAsciiLetter_isRejected() {
        assertThatThrownBy(() -> tokenize("a + é"))
                .isInstanceOf(ExpressionLexException.class)
                .satisfies(e -> assertThat(((ExpressionLexException) e).getPosition()).isEqualTo(4));
    }
}
