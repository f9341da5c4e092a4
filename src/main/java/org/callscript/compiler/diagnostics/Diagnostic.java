package org.callscript.compiler.diagnostics;

import org.callscript.compiler.api.CompilerPhase;

/**
 * Represents a single diagnostic message (error or warning)
 * that occurs during the compilation process.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param phase The compiler phase that reported it.
 * @param message The diagnostic message.
 * @param programName The name of the program being compiled.
 */
public record Diagnostic(
        Type type,
        CompilerPhase phase,
        String message,
        String programName
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s (%s): %s", type, programName, phase, message);
    }
}
