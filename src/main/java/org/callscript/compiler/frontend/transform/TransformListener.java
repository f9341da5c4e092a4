package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.ir.IrNode;

/**
 * Observes the traversal of the source AST during transformation.
 * {@link #enter} fires before a node's children are converted (pre-order),
 * {@link #exit} after the node's target node has been built.
 */
public interface TransformListener {

	/**
	 * Called before the node is converted.
	 * @param node   The node being entered.
	 * @param parent Its source parent, or null for the root.
	 */
	default void enter(AstNode node, AstNode parent) {}

	/**
	 * Called after the node has been converted.
	 * @param node   The node being left.
	 * @param parent Its source parent, or null for the root.
	 * @param result The target node built for it.
	 */
	default void exit(AstNode node, AstNode parent, IrNode result) {}
}
