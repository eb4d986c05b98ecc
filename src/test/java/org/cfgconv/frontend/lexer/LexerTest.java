package org.cfgconv.frontend.lexer;

import org.cfgconv.diagnostics.Diagnostic;
import org.cfgconv.diagnostics.DiagnosticsEngine;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for the {@link Lexer}.
 * These tests verify that the lexer correctly converts source code strings into a stream of tokens,
 * including compound keywords, bracket expressions, comments and the permissive skipping of
 * unrecognized input.
 */
public class LexerTest {

    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();

    private List<Token> scan(String source) {
        return new Lexer(source, diagnostics).scanTokens();
    }

    private List<TokenType> types(String source) {
        return scan(source).stream().map(Token::type).toList();
    }

    /**
     * Verifies the token stream of a short definition and assignment, including positions
     * and the line counting across a line comment.
     */
    @Test
    @Tag("unit")
    void testLexerTokenization() {
        // Arrange
        String source = String.join("\n",
                "a := 0xFF; # the answer",
                "b = \"x\"");

        // Act
        List<Token> tokens = scan(source);

        // Assert
        assertThat(diagnostics.hasWarnings()).isFalse();
        assertThat(tokens).hasSize(8);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.IDENTIFIER, "a", 1, 1);
        assertThat(tokens.get(1)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.DEFINE, ":=", 1, 3);
        assertThat(tokens.get(2)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.HEX_NUMBER, "0xFF", 1, 6);
        assertThat(tokens.get(3)).extracting(Token::type, Token::column).containsExactly(TokenType.SEMICOLON, 10);
        assertThat(tokens.get(4)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.IDENTIFIER, "b", 2, 1);
        assertThat(tokens.get(5)).extracting(Token::type, Token::line, Token::column).containsExactly(TokenType.ASSIGN, 2, 3);
        assertThat(tokens.get(6)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.STRING, "\"x\"", 2, 5);
        assertThat(tokens.get(7).type()).isEqualTo(TokenType.END_OF_FILE);
    }

    @Test
    @Tag("unit")
    void testCompoundKeywordsWinOverTheirPrefixes() {
        assertThat(types("struct{ } (list ) chr( ) := = , ;"))
                .containsExactly(TokenType.STRUCT_START, TokenType.STRUCT_END, TokenType.LIST_START, TokenType.RPAREN,
                        TokenType.CHR_START, TokenType.RPAREN, TokenType.DEFINE, TokenType.ASSIGN, TokenType.COMMA,
                        TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    @Tag("unit")
    void testKeywordsMatchAsPrefixesBeforeIdentifiers() {
        List<Token> tokens = scan("true false trueish false_flag (list1");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.TRUE, "true"),
                tuple(TokenType.FALSE, "false"),
                tuple(TokenType.TRUE, "true"),
                tuple(TokenType.IDENTIFIER, "ish"),
                tuple(TokenType.FALSE, "false"),
                tuple(TokenType.IDENTIFIER, "_flag"),
                tuple(TokenType.LIST_START, "(list"),
                tuple(TokenType.NUMBER, "1"),
                tuple(TokenType.END_OF_FILE, ""));
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    @Tag("unit")
    void testNumbers() {
        List<Token> tokens = scan("42 0x1f 0XAB 0xZ 007");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.NUMBER, "42"),
                tuple(TokenType.HEX_NUMBER, "0x1f"),
                tuple(TokenType.HEX_NUMBER, "0XAB"),
                tuple(TokenType.NUMBER, "0"),
                tuple(TokenType.IDENTIFIER, "xZ"),
                tuple(TokenType.NUMBER, "007"),
                tuple(TokenType.END_OF_FILE, ""));
    }

    /**
     * Verifies that a bracket with an operator and at least one operand becomes a single
     * EXPRESSION token spanning the whole bracket.
     */
    @Test
    @Tag("unit")
    void testBracketExpressionIsOneToken() {
        List<Token> tokens = scan("x = [+ 2 3];");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.EXPRESSION, TokenType.SEMICOLON, TokenType.END_OF_FILE);
        assertThat(tokens.get(2)).extracting(Token::text, Token::column).containsExactly("[+ 2 3]", 5);
        assertThat(tokens.get(3).column()).isEqualTo(12);
    }

    @Test
    @Tag("unit")
    void testSingleOperandBracketExpressionIsAccepted() {
        List<Token> tokens = scan("[* 5]");

        assertThat(tokens.get(0)).extracting(Token::type, Token::text).containsExactly(TokenType.EXPRESSION, "[* 5]");
    }

    /**
     * Verifies that a bracket without a leading operator is not an expression: the brackets are
     * skipped as unknown characters and the content is tokenized normally.
     */
    @Test
    @Tag("unit")
    void testBracketWithoutOperatorFallsBackToSkipping() {
        List<Token> tokens = scan("[x 1]");

        assertThat(tokens).extracting(Token::type, Token::text).containsExactly(
                tuple(TokenType.IDENTIFIER, "x"),
                tuple(TokenType.NUMBER, "1"),
                tuple(TokenType.END_OF_FILE, ""));
        assertThat(diagnostics.getDiagnostics()).hasSize(2)
                .allMatch(d -> d.type() == Diagnostic.Type.WARNING);
    }

    @Test
    @Tag("unit")
    void testUnclosedBracketIsSkipped() {
        assertThat(types("[+ 1 2")).containsExactly(TokenType.NUMBER, TokenType.NUMBER, TokenType.END_OF_FILE);
        // '[' and '+' are both skipped.
        assertThat(diagnostics.getDiagnostics()).hasSize(2);
    }

    @Test
    @Tag("unit")
    void testBlockCommentSpanningLines() {
        List<Token> tokens = scan("{- a\n b -} c");

        assertThat(tokens).hasSize(2);
        assertThat(tokens.get(0)).extracting(Token::type, Token::text, Token::line, Token::column)
                .containsExactly(TokenType.IDENTIFIER, "c", 2, 7);
    }

    @Test
    @Tag("unit")
    void testUnterminatedBlockCommentStopsScanning() {
        List<Token> tokens = scan("x {- never closed\n y = 1");

        assertThat(tokens).extracting(Token::type).containsExactly(TokenType.IDENTIFIER, TokenType.END_OF_FILE);
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("Unterminated block comment"));
    }

    @Test
    @Tag("unit")
    void testEscapedQuoteDoesNotTerminateString() {
        List<Token> tokens = scan("\"a\\\"b\" 'c'");

        assertThat(tokens.get(0)).extracting(Token::type, Token::text).containsExactly(TokenType.STRING, "\"a\\\"b\"");
        assertThat(tokens.get(1)).extracting(Token::type, Token::text).containsExactly(TokenType.STRING, "'c'");
    }

    /**
     * Verifies that an unterminated string only loses its opening quote; the rest of the input
     * is tokenized as usual.
     */
    @Test
    @Tag("unit")
    void testUnterminatedStringSkipsOpeningQuote() {
        List<Token> tokens = scan("'abc = 1");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(0)).extracting(Token::text, Token::column).containsExactly("abc", 2);
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("Unterminated string"));
    }

    @Test
    @Tag("unit")
    void testStringSpanningLinesAdvancesLineCounter() {
        List<Token> tokens = scan("s = 'line one\nline two' t");

        assertThat(tokens.get(2).type()).isEqualTo(TokenType.STRING);
        assertThat(tokens.get(3)).extracting(Token::text, Token::line, Token::column).containsExactly("t", 2, 11);
    }

    @Test
    @Tag("unit")
    void testUnknownCharactersAreSkippedSilently() {
        List<Token> tokens = scan("a @= 1");

        assertThat(tokens).extracting(Token::type).containsExactly(
                TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.NUMBER, TokenType.END_OF_FILE);
        assertThat(tokens.get(1).column()).isEqualTo(4);
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.message()).isEqualTo("Skipped unexpected character: @");
                    assertThat(d.columnNumber()).isEqualTo(3);
                });
    }

    @Test
    @Tag("unit")
    void testEndOfFileIsRepeated() {
        Lexer lexer = new Lexer("x", diagnostics, "test.cfg");

        assertThat(lexer.nextToken().type()).isEqualTo(TokenType.IDENTIFIER);
        Token first = lexer.nextToken();
        Token second = lexer.nextToken();

        assertThat(first.type()).isEqualTo(TokenType.END_OF_FILE);
        assertThat(second).isEqualTo(first);
        assertThat(first.fileName()).isEqualTo("test.cfg");
    }
}
