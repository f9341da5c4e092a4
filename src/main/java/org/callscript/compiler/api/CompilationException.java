package org.callscript.compiler.api;

/**
 * An exception that is thrown when an error occurs during the compilation process.
 * <p>
 * Every phase throws its own subclass; callers that only care about failure can catch this type
 * and inspect {@link #errorCode()} and {@link #phase()}.
 */
public class CompilationException extends Exception {

    private final CompilerErrorCode errorCode;
    private final CompilerPhase phase;

    /**
     * Constructs a new compilation exception.
     * @param errorCode The code identifying the kind of error.
     * @param phase The phase in which the error occurred.
     * @param message The detail message, naming the offending construct.
     */
    public CompilationException(CompilerErrorCode errorCode, CompilerPhase phase, String message) {
        super(message);
        this.errorCode = errorCode;
        this.phase = phase;
    }

    /**
     * @return The code identifying the kind of error.
     */
    public CompilerErrorCode errorCode() {
        return errorCode;
    }

    /**
     * @return The phase in which the error occurred.
     */
    public CompilerPhase phase() {
        return phase;
    }

    @Override
    public String toString() {
        return String.format("%s[%s/%s]: %s", getClass().getSimpleName(), phase, errorCode, getMessage());
    }
}
