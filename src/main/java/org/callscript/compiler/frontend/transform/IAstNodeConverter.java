package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.ir.IrNode;

/**
 * Converts a specific source AST node type into a target AST node.
 * <p>
 * Implementations should be stateless. Children are converted through
 * {@link TransformContext#convertAll(java.util.List, AstNode)} and the results returned,
 * never collected in shared state.
 *
 * @param <T> The concrete AST node type handled by this converter.
 * @param <R> The target node type produced.
 */
public interface IAstNodeConverter<T extends AstNode, R extends IrNode> {

	/**
	 * Converts the given AST node.
	 *
	 * @param node   The AST node to convert.
	 * @param parent The source parent of the node, or null for the root.
	 * @param ctx    The transformation context used to convert children and report errors.
	 * @return The target node built for {@code node}.
	 * @throws TransformException if the node cannot appear at this position.
	 */
	R convert(T node, AstNode parent, TransformContext ctx) throws TransformException;
}
