package org.callscript.compiler.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A '(' or ')' character. */
    PAREN,
    /** A run of decimal digits. */
    NUMBER,
    /** A quoted string; the token text excludes the quotes. */
    STRING,
    /** A run of letters, used as a function name. */
    NAME
}
