package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.ir.IrProgram;

import java.util.List;

/**
 * Phase: Converts the source AST into the target AST by delegating to converters
 * resolved via the {@link ConverterRegistry}.
 * <p>
 * The traversal is depth-first and pre-order. Each converter returns the node it built and
 * the caller places it into its own child list, so parent/child wiring never goes through
 * shared mutable lists.
 */
public final class Transformer {

	private final DiagnosticsEngine diagnostics;
	private final ConverterRegistry registry;
	private final List<TransformListener> listeners;

	/**
	 * Creates a new transformer with the built-in converters and no listeners.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 */
	public Transformer(DiagnosticsEngine diagnostics) {
		this(diagnostics, ConverterRegistry.initializeWithDefaults(), List.of());
	}

	/**
	 * Creates a new transformer.
	 *
	 * @param diagnostics The diagnostics engine for reporting issues.
	 * @param registry    The converter registry.
	 * @param listeners   Listeners observing the traversal.
	 */
	public Transformer(DiagnosticsEngine diagnostics, ConverterRegistry registry, List<TransformListener> listeners) {
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Transforms an anonymous program.
	 *
	 * @param ast The source AST.
	 * @return The target AST.
	 * @throws TransformException if the tree contains a node at a position it cannot occupy.
	 */
	public IrProgram transform(ProgramNode ast) throws TransformException {
		return transform(ast, "<memory>");
	}

	/**
	 * Transforms the source AST into the target AST.
	 *
	 * @param ast         The source AST.
	 * @param programName The program name used for diagnostics.
	 * @return The target AST.
	 * @throws TransformException if the tree contains a node at a position it cannot occupy.
	 */
	public IrProgram transform(ProgramNode ast, String programName) throws TransformException {
		TransformContext ctx = new TransformContext(programName, diagnostics, registry, listeners);
		// The registry's program slot is typed to produce an IrProgram.
		return (IrProgram) ctx.convert(ast, null);
	}
}
