package org.callscript.compiler.ir;

/**
 * A visitor for the target AST, one method per node kind.
 *
 * @param <T> The return type of the visit methods.
 * @param <X> The exception type the visit methods may throw.
 */
public interface IrVisitor<T, X extends Exception> {
    T visit(IrProgram node) throws X;
    T visit(IrExpressionStatement node) throws X;
    T visit(IrCallExpression node) throws X;
    T visit(IrIdentifier node) throws X;
    T visit(IrNumberLiteral node) throws X;
    T visit(IrStringLiteral node) throws X;
}
