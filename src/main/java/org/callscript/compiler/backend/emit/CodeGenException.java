package org.callscript.compiler.backend.emit;

import org.callscript.compiler.api.CompilationException;
import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;

/**
 * Thrown by the {@link Emitter} for a target AST node it cannot render at its position.
 */
public class CodeGenException extends CompilationException {

    /**
     * @param errorCode The error code, normally {@link CompilerErrorCode#UNHANDLED_NODE_KIND}.
     * @param message The detail message.
     */
    public CodeGenException(CompilerErrorCode errorCode, String message) {
        super(errorCode, CompilerPhase.CODE_GENERATION, message);
    }
}
