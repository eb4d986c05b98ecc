package org.cfgconv.frontend.parser;

import org.cfgconv.api.SyntaxErrorCode;
import org.cfgconv.api.SyntaxException;
import org.cfgconv.diagnostics.DiagnosticsEngine;
import org.cfgconv.frontend.lexer.Token;
import org.cfgconv.frontend.lexer.TokenType;
import org.cfgconv.model.Value;

/**
 * An interface that encapsulates the state of one parse session.
 * It provides value handlers with access to the token stream, the constant table
 * and the diagnostics without coupling them directly to the parser implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Consumes the current token if it is of the expected type.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     * @throws SyntaxException if the current token is of another type.
     */
    Token consume(TokenType type, String errorMessage) throws SyntaxException;

    /**
     * Parses one value starting at the current token.
     * @return The fully resolved value.
     * @throws SyntaxException if the tokens do not form a value.
     */
    Value parseValue() throws SyntaxException;

    /**
     * Reports an error at the given token and creates the exception to throw.
     * @param code The error code.
     * @param message The error message.
     * @param at The token at which the error was detected.
     * @param expected What was expected instead.
     * @return The exception, for the caller to throw.
     */
    SyntaxException error(SyntaxErrorCode code, String message, Token at, String expected);

    /**
     * Gets the constant table of the current parse session.
     * @return The constant table.
     */
    ConstantTable getConstants();

    /**
     * Gets the diagnostics engine for reporting recoverable problems.
     * @return The diagnostics engine.
     */
    DiagnosticsEngine getDiagnostics();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();
}
