package org.callscript.compiler.frontend.parser;

import org.callscript.compiler.api.CompilationException;
import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;

/**
 * Thrown by the {@link Parser} for malformed or unbalanced call expressions.
 */
public class ParseException extends CompilationException {

    /**
     * @param errorCode One of the parser error codes.
     * @param message The detail message.
     */
    public ParseException(CompilerErrorCode errorCode, String message) {
        super(errorCode, CompilerPhase.PARSING, message);
    }
}
