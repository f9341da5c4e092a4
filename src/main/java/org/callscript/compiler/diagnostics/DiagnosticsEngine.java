package org.callscript.compiler.diagnostics;

import org.callscript.compiler.api.CompilerPhase;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting and managing diagnostic messages (errors, warnings)
 * that occur during the compilation process.
 * <p>
 * One instance belongs to exactly one compilation; it is not thread-safe.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param phase       The phase in which the error occurred.
     * @param message     The error message.
     * @param programName The program in which the error occurred.
     */
    public void reportError(CompilerPhase phase, String message, String programName) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, phase, message, programName));
    }

    /**
     * Reports a warning.
     *
     * @param phase       The phase in which the warning occurred.
     * @param message     The warning message.
     * @param programName The program in which the warning occurred.
     */
    public void reportWarning(CompilerPhase phase, String message, String programName) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, phase, message, programName));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns the reported warnings, in reporting order.
     *
     * @return An unmodifiable list of warnings.
     */
    public List<Diagnostic> warnings() {
        return diagnostics.stream()
                .filter(d -> d.type() == Diagnostic.Type.WARNING)
                .toList();
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
