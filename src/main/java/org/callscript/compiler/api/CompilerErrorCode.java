package org.callscript.compiler.api;

/**
 * Defines unique, testable error codes for all errors that can occur during compilation.
 * This decouples the test logic from the error messages.
 */
public enum CompilerErrorCode {
    // region Lexer Errors
    /** A character that is not whitespace, a digit, a letter, a quote or a parenthesis. */
    UNEXPECTED_CHARACTER,
    /** A string literal without its closing quote. */
    UNTERMINATED_STRING,
    // endregion

    // region Parser Errors
    /** A token that cannot start an expression at this position. */
    UNEXPECTED_TOKEN,
    /** The tokens ran out inside an unclosed call expression. */
    UNEXPECTED_END_OF_INPUT,
    /** The token after '(' is not a name. */
    INVALID_CALLEE,
    /** Calls are nested deeper than the configured maximum depth. */
    NESTING_TOO_DEEP,
    // endregion

    // region Transformation & Code Generation Errors
    /** A tree contains a node kind the phase cannot handle at that position. */
    UNHANDLED_NODE_KIND
    // endregion
}
