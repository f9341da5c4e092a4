package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.ir.IrNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Context passed to converters during one transformation.
 * Provides child conversion, listener notification and error reporting.
 * It holds no target nodes itself; converters return what they build.
 */
public final class TransformContext {

	private final String programName;
	private final DiagnosticsEngine diagnostics;
	private final ConverterRegistry registry;
	private final List<TransformListener> listeners;

	/**
	 * Constructs a new transformation context.
	 * @param programName The name of the program being compiled.
	 * @param diagnostics The diagnostics engine for reporting errors and warnings.
	 * @param registry The registry for resolving AST node converters.
	 * @param listeners Listeners notified on entering and leaving each node.
	 */
	public TransformContext(String programName, DiagnosticsEngine diagnostics, ConverterRegistry registry,
							List<TransformListener> listeners) {
		this.programName = programName;
		this.diagnostics = diagnostics;
		this.registry = registry;
		this.listeners = List.copyOf(listeners);
	}

	/**
	 * Converts the given AST node by resolving and invoking the appropriate converter.
	 * @param node The node to convert.
	 * @param parent The source parent of the node, or null for the root.
	 * @return The target node.
	 * @throws TransformException if the node cannot be converted at this position.
	 */
	public IrNode convert(AstNode node, AstNode parent) throws TransformException {
		if (node == null) {
			throw error("Cannot convert a null node below " + describe(parent) + ".");
		}
		for (TransformListener listener : listeners) {
			listener.enter(node, parent);
		}
		IrNode result = registry.resolveAndConvert(node, parent, this);
		for (TransformListener listener : listeners) {
			listener.exit(node, parent, result);
		}
		return result;
	}

	/**
	 * Converts a sequence of children, preserving their order.
	 * @param children The children to convert.
	 * @param parent Their common source parent.
	 * @return A new list with one target node per child.
	 * @throws TransformException if any child cannot be converted.
	 */
	public List<IrNode> convertAll(List<AstNode> children, AstNode parent) throws TransformException {
		List<IrNode> out = new ArrayList<>(children.size());
		for (AstNode child : children) {
			out.add(convert(child, parent));
		}
		return out;
	}

	/**
	 * Reports an {@link CompilerErrorCode#UNHANDLED_NODE_KIND} error and returns the exception to throw.
	 * @param message The error message.
	 * @return The exception.
	 */
	public TransformException error(String message) {
		diagnostics.reportError(CompilerPhase.TRANSFORMATION, message, programName);
		return new TransformException(CompilerErrorCode.UNHANDLED_NODE_KIND, message);
	}

	private static String describe(AstNode node) {
		return node == null ? "the root" : node.getClass().getSimpleName();
	}
}
