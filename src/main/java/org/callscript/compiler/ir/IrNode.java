package org.callscript.compiler.ir;

/**
 * Base type for the nodes of the target AST, the C-like call program that the emitter renders.
 * The hierarchy is closed; phases dispatch over it through an {@link IrVisitor}.
 */
public sealed interface IrNode permits IrProgram, IrExpressionStatement, IrCallExpression, IrIdentifier, IrNumberLiteral, IrStringLiteral {

    /**
     * Dispatches to the visit method for this node's kind.
     *
     * @param visitor The visitor.
     * @param <T> The result type of the visitor.
     * @param <X> The exception type the visitor may throw.
     * @return The visitor's result.
     * @throws X if the visitor fails.
     */
    <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X;
}
