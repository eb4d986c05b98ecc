package org.cfgconv.frontend.lexer;

import org.cfgconv.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Tokens are produced on demand by {@link #nextToken()}. The lexer is permissive:
 * characters it cannot place into any token are skipped and recorded as warnings.
 */
public class Lexer {

    private static final Set<String> OPERATORS = Set.of("+", "-", "*", "/");

    // Compound patterns must come before their single-character prefixes. Keywords are
    // plain prefixes and win over identifiers, so "trueish" scans as TRUE followed by "ish".
    private static final Map<String, TokenType> KEYWORDS = new LinkedHashMap<>();
    static {
        KEYWORDS.put("struct{", TokenType.STRUCT_START);
        KEYWORDS.put("(list", TokenType.LIST_START);
        KEYWORDS.put("chr(", TokenType.CHR_START);
        KEYWORDS.put(":=", TokenType.DEFINE);
        KEYWORDS.put(";", TokenType.SEMICOLON);
        KEYWORDS.put("=", TokenType.ASSIGN);
        KEYWORDS.put(",", TokenType.COMMA);
        KEYWORDS.put("}", TokenType.STRUCT_END);
        KEYWORDS.put(")", TokenType.RPAREN);
        KEYWORDS.put("true", TokenType.TRUE);
        KEYWORDS.put("false", TokenType.FALSE);
    }

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final String logicalFileName;
    private int current = 0;
    private int line = 1;
    private int column = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting skipped input.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting skipped input.
     * @param logicalFileName The name of the source, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire remaining source code.
     * @return A list of the recognized tokens, terminated by an END_OF_FILE token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.END_OF_FILE);
        return tokens;
    }

    /**
     * Scans the next token. Once the source is exhausted, every call returns an END_OF_FILE token.
     * @return The next token.
     */
    public Token nextToken() {
        while (!isAtEnd()) {
            char c = peek();

            if (c == '#') {
                skipLineComment();
                continue;
            }
            if (startsWith("{-")) {
                skipBlockComment();
                continue;
            }
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }

            Token token = null;
            if (c == '[') {
                token = bracketExpression();
            }
            if (token == null) token = keyword();
            if (token == null) token = identifier();
            if (token == null) token = number();
            if (token == null) token = string();
            if (token != null) {
                return token;
            }

            if (c == '"' || c == '\'') {
                diagnostics.reportWarning("Unterminated string literal, skipped opening quote", logicalFileName, line, column);
            } else {
                diagnostics.reportWarning("Skipped unexpected character: " + c, logicalFileName, line, column);
            }
            advance();
        }
        return new Token(TokenType.END_OF_FILE, "", line, column, logicalFileName);
    }

    private void skipLineComment() {
        // The newline belongs to the comment.
        while (!isAtEnd() && peek() != '\n') advance();
        if (!isAtEnd()) advance();
    }

    private void skipBlockComment() {
        int startLine = line;
        int startColumn = column;
        advance();
        advance();
        while (!isAtEnd()) {
            if (startsWith("-}")) {
                advance();
                advance();
                return;
            }
            advance();
        }
        diagnostics.reportWarning("Unterminated block comment", logicalFileName, startLine, startColumn);
    }

    private Token bracketExpression() {
        int end = current;
        int depth = 0;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '[') {
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth == 0) break;
            }
            end++;
        }
        if (end >= source.length()) {
            return null;
        }

        String[] parts = source.substring(current + 1, end).trim().split("\\s+");
        if (parts.length < 2 || !OPERATORS.contains(parts[0])) {
            return null;
        }
        return emit(TokenType.EXPRESSION, end + 1 - current);
    }

    private Token keyword() {
        for (Map.Entry<String, TokenType> entry : KEYWORDS.entrySet()) {
            String pattern = entry.getKey();
            if (startsWith(pattern)) {
                return emit(entry.getValue(), pattern.length());
            }
        }
        return null;
    }

    private Token identifier() {
        if (!isAlpha(peek())) return null;
        int end = current + 1;
        while (isAlphaNumeric(charAt(end))) end++;
        return emit(TokenType.IDENTIFIER, end - current);
    }

    private Token number() {
        if (peek() == '0' && (charAt(current + 1) == 'x' || charAt(current + 1) == 'X') && isHexDigit(charAt(current + 2))) {
            int end = current + 2;
            while (isHexDigit(charAt(end))) end++;
            return emit(TokenType.HEX_NUMBER, end - current);
        }
        if (!isDigit(peek())) return null;
        int end = current + 1;
        while (isDigit(charAt(end))) end++;
        return emit(TokenType.NUMBER, end - current);
    }

    private Token string() {
        char quote = peek();
        if (quote != '"' && quote != '\'') return null;

        for (int end = current + 1; end < source.length(); end++) {
            if (source.charAt(end) == quote && source.charAt(end - 1) != '\\') {
                return emit(TokenType.STRING, end + 1 - current);
            }
        }
        return null;
    }

    private Token emit(TokenType type, int length) {
        Token token = new Token(type, source.substring(current, current + length), line, column, logicalFileName);
        for (int i = 0; i < length; i++) {
            advance();
        }
        return token;
    }

    private void advance() {
        if (source.charAt(current++) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private boolean startsWith(String prefix) {
        return source.startsWith(prefix, current);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return charAt(current);
    }

    private char charAt(int index) {
        if (index >= source.length()) return '\0';
        return source.charAt(index);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isHexDigit(char c) {
        return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
