package org.cfgconv.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., Identifier, Number, Define).
 * @param text The exact text of the token from the source code, including quotes for strings
 *             and brackets for bracket expressions.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical source name the token originates from.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column,
        String fileName
) {
}
