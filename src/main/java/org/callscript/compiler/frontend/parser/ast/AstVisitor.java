package org.callscript.compiler.frontend.parser.ast;

/**
 * A visitor for the source Abstract Syntax Tree, one method per node kind.
 *
 * @param <T> The return type of the visit methods.
 * @param <X> The exception type the visit methods may throw.
 */
public interface AstVisitor<T, X extends Exception> {
    T visit(ProgramNode node) throws X;
    T visit(CallExpressionNode node) throws X;
    T visit(NumberLiteralNode node) throws X;
    T visit(StringLiteralNode node) throws X;
}
