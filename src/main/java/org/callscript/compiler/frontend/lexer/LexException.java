package org.callscript.compiler.frontend.lexer;

import org.callscript.compiler.api.CompilationException;
import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;

/**
 * Thrown by the {@link Lexer} for the first character sequence it cannot tokenize.
 */
public class LexException extends CompilationException {

    /**
     * @param errorCode Either {@link CompilerErrorCode#UNEXPECTED_CHARACTER} or {@link CompilerErrorCode#UNTERMINATED_STRING}.
     * @param message The detail message.
     */
    public LexException(CompilerErrorCode errorCode, String message) {
        super(errorCode, CompilerPhase.LEXING, message);
    }
}
