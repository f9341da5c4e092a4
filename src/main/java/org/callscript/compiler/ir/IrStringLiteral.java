package org.callscript.compiler.ir;

/**
 * A string literal.
 *
 * @param value The string content without quotes.
 */
public record IrStringLiteral(String value) implements IrNode {

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
