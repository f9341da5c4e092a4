package org.callscript.compiler;

import org.callscript.compiler.api.CompilationException;
import org.callscript.compiler.api.ICompiler;
import org.callscript.compiler.backend.emit.Emitter;
import org.callscript.compiler.config.CompilerConfig;
import org.callscript.compiler.config.CompilerOptions;
import org.callscript.compiler.diagnostics.CompilerLogger;
import org.callscript.compiler.diagnostics.Diagnostic;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.lexer.Lexer;
import org.callscript.compiler.frontend.lexer.Token;
import org.callscript.compiler.frontend.parser.Parser;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.transform.ConverterRegistry;
import org.callscript.compiler.frontend.transform.TracingTransformListener;
import org.callscript.compiler.frontend.transform.Transformer;
import org.callscript.compiler.ir.IrProgram;
import org.callscript.compiler.util.DebugDump;

import java.util.List;
import java.util.Objects;

/**
 * The main compiler implementation. This class orchestrates the pipeline
 * lexer, parser, transformer and emitter, each stage consuming the complete output of the previous one.
 * <p>
 * The instance only holds immutable options; all per-compilation state is created inside
 * {@link #compile(String, String)}, so one instance can serve concurrent callers.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;
    private final ConverterRegistry converters = ConverterRegistry.initializeWithDefaults();
    private final Emitter emitter = new Emitter();

    /**
     * Creates a compiler with options read from the configuration (see {@link CompilerConfig#load()}).
     */
    public Compiler() {
        this(CompilerOptions.fromConfig(CompilerConfig.load()));
    }

    /**
     * Creates a compiler with explicit options.
     * @param options The compiler options.
     */
    public Compiler(CompilerOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * @return The options this compiler runs with.
     */
    public CompilerOptions options() {
        return options;
    }

    @Override
    public String compile(String source, String programName) throws CompilationException {
        Objects.requireNonNull(source, "source");
        if (options.verbosity() >= 0) {
            CompilerLogger.setLevel(options.verbosity());
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            // Phase 1: Lexical Analysis
            List<Token> tokens = new Lexer(source, diagnostics, programName).scanTokens();
            CompilerLogger.debug("Compiler: " + programName + ": " + tokens.size() + " tokens");
            if (options.dumpPhases()) {
                CompilerLogger.debug("Tokens of " + programName + ":\n" + DebugDump.dumpTokens(tokens));
            }

            // Phase 2: Parsing (builds AST)
            ProgramNode ast = new Parser(tokens, diagnostics, options, programName).parse();
            CompilerLogger.debug("Compiler: " + programName + ": " + ast.body().size() + " top-level expressions");
            if (options.dumpPhases()) {
                CompilerLogger.debug("AST of " + programName + ":\n" + DebugDump.dumpAst(ast));
            }

            // Phase 3: Transformation (source AST -> target AST)
            Transformer transformer = new Transformer(diagnostics, converters, List.of(new TracingTransformListener()));
            IrProgram ir = transformer.transform(ast, programName);
            if (options.dumpPhases()) {
                CompilerLogger.debug("Target AST of " + programName + ":\n" + DebugDump.dumpIr(ir));
            }

            // Phase 4: Code Generation
            String output = emitter.emit(ir);
            CompilerLogger.debug("Compiler: " + programName + ": emitted " + output.length() + " characters");
            return output;
        } catch (CompilationException e) {
            CompilerLogger.warn("Compilation of " + programName + " failed in phase " + e.phase() + ":\n" + diagnostics.summary());
            throw e;
        } finally {
            for (Diagnostic warning : diagnostics.warnings()) {
                CompilerLogger.warn(warning.toString());
            }
        }
    }
}
