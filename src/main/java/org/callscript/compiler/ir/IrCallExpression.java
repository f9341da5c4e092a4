package org.callscript.compiler.ir;

import java.util.List;

/**
 * A call in the target AST.
 *
 * @param callee The called function.
 * @param arguments The arguments, in source order.
 */
public record IrCallExpression(IrIdentifier callee, List<IrNode> arguments) implements IrNode {

    public IrCallExpression {
        arguments = arguments == null ? List.of() : List.copyOf(arguments);
    }

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
