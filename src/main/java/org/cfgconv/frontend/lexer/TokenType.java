package org.cfgconv.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    // Literals.
    /** A name, such as a constant, entry or struct field name. */
    IDENTIFIER,
    /** A decimal integer literal. */
    NUMBER,
    /** A hexadecimal integer literal with a 0x or 0X prefix. */
    HEX_NUMBER,
    /** A single- or double-quoted string literal, quotes included. */
    STRING,
    /** The keyword 'true'. */
    TRUE,
    /** The keyword 'false'. */
    FALSE,
    /** A complete bracket expression such as '[+ 1 2]'. */
    EXPRESSION,

    // Compound openers.
    /** The '(list' marker that opens a list literal. */
    LIST_START,
    /** The 'struct{' marker that opens a struct literal. */
    STRUCT_START,
    /** The 'chr(' marker that opens a character conversion. */
    CHR_START,

    // Punctuation.
    /** The ')' character, closing lists and character conversions. */
    RPAREN,
    /** The '}' character, closing struct literals. */
    STRUCT_END,
    /** The '=' character. */
    ASSIGN,
    /** The ':=' operator that defines a constant. */
    DEFINE,
    /** The ',' character. */
    COMMA,
    /** The ';' character. */
    SEMICOLON,

    /** Represents the end of the source. */
    END_OF_FILE
}
