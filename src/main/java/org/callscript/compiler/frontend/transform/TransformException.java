package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.api.CompilationException;
import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;

/**
 * Thrown when the source AST violates the shape the parser guarantees,
 * e.g. a program node nested inside another node.
 */
public class TransformException extends CompilationException {

    /**
     * @param errorCode The error code, normally {@link CompilerErrorCode#UNHANDLED_NODE_KIND}.
     * @param message The detail message.
     */
    public TransformException(CompilerErrorCode errorCode, String message) {
        super(errorCode, CompilerPhase.TRANSFORMATION, message);
    }
}
