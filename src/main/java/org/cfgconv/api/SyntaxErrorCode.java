package org.cfgconv.api;

/**
 * Defines unique, testable error codes for all syntax errors a conversion can raise.
 * This decouples the test logic from the error messages.
 */
public enum SyntaxErrorCode {
    /** A specific token was required (e.g. ')' closing a list) but another one was found. */
    UNEXPECTED_TOKEN,
    /** A token that cannot start a value was found where a value was expected. */
    UNEXPECTED_VALUE,
    /** A bracket expression has fewer than two parts. */
    MALFORMED_EXPRESSION,
    /** A bracket expression uses an operator other than + - * /. */
    UNKNOWN_OPERATOR,
    /** A bracket expression argument is not an integer. */
    NON_NUMERIC_ARGUMENT,
    /** An integer literal does not fit into 64 bits. */
    NUMBER_OUT_OF_RANGE,
    /** A bracket expression result does not fit into 64 bits. */
    ARITHMETIC_OVERFLOW
}
