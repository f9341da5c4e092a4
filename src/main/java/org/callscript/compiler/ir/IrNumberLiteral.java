package org.callscript.compiler.ir;

/**
 * A numeric literal, kept as the original digit text.
 *
 * @param value The digits.
 */
public record IrNumberLiteral(String value) implements IrNode {

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
