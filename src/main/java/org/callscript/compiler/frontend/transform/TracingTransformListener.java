package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.diagnostics.CompilerLogger;
import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.ir.IrNode;

/**
 * Logs every entered and converted node at TRACE level, indented by depth.
 * Holds the current depth, so use one instance per transformation.
 */
public final class TracingTransformListener implements TransformListener {

	private int depth = 0;

	@Override
	public void enter(AstNode node, AstNode parent) {
		if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
			CompilerLogger.trace("  ".repeat(depth) + "enter " + node.getClass().getSimpleName());
		}
		depth++;
	}

	@Override
	public void exit(AstNode node, AstNode parent, IrNode result) {
		depth--;
		if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
			CompilerLogger.trace("  ".repeat(depth) + "exit  " + node.getClass().getSimpleName()
					+ " -> " + result.getClass().getSimpleName());
		}
	}
}
