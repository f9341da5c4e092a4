package org.callscript.compiler.ir;

/**
 * Wraps a call whose source parent is the program, i.e. a top-level call.
 *
 * @param expression The wrapped expression.
 */
public record IrExpressionStatement(IrNode expression) implements IrNode {

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
