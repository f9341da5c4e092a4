package org.callscript.compiler.ir;

/**
 * The name of a called function.
 *
 * @param name The identifier text.
 */
public record IrIdentifier(String name) implements IrNode {

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
