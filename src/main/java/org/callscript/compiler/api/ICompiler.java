package org.callscript.compiler.api;

/**
 * Defines the public interface of the CallScript compiler.
 * <p>
 * An implementation takes a program in parenthesized call syntax, e.g. {@code (add 2 (subtract 4 2))},
 * and returns the equivalent program in C-like call syntax, e.g. {@code add(2, subtract(4, 2));}.
 */
public interface ICompiler {

    /**
     * Compiles the given source code.
     *
     * @param source The complete source program.
     * @param programName A name for the program, used in diagnostics and log output.
     * @return The generated program text, one line per top-level expression.
     * @throws CompilationException if any phase of the compilation fails.
     */
    String compile(String source, String programName) throws CompilationException;

    /**
     * Compiles an anonymous, in-memory program.
     *
     * @param source The complete source program.
     * @return The generated program text.
     * @throws CompilationException if any phase of the compilation fails.
     */
    default String compile(String source) throws CompilationException {
        return compile(source, "<memory>");
    }
}
