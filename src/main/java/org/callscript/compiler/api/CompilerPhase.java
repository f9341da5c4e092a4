package org.callscript.compiler.api;

/**
 * Defines the phases of the compilation pipeline, in execution order.
 */
public enum CompilerPhase {
    /** Phase 1: Converts source text into tokens. */
    LEXING,

    /** Phase 2: Builds the source AST from the tokens. */
    PARSING,

    /** Phase 3: Converts the source AST into the target AST. */
    TRANSFORMATION,

    /** Phase 4: Renders the target AST as text. */
    CODE_GENERATION
}
