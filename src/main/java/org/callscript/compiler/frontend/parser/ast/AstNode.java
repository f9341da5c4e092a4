package org.callscript.compiler.frontend.parser.ast;

import java.util.Collections;
import java.util.List;

/**
 * The base interface for all nodes in the source Abstract Syntax Tree (AST).
 * <p>
 * The hierarchy is closed: every phase that dispatches over node kinds does so through
 * an {@link AstVisitor}, so adding a kind forces every phase to handle it.
 */
public sealed interface AstNode permits ProgramNode, CallExpressionNode, NumberLiteralNode, StringLiteralNode {

    /**
     * Returns a list of the direct child nodes.
     * This allows generic code (e.g. debug dumps) to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * Dispatches to the visit method for this node's kind.
     *
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @param <X> The exception type the visitor may throw.
     * @return The visitor's result.
     * @throws X if the visitor fails.
     */
    <T, X extends Exception> T accept(AstVisitor<T, X> visitor) throws X;
}
