package org.callscript.compiler.ir;

import java.util.List;

/**
 * The root of the target AST.
 *
 * @param body The top-level statements, in source order.
 */
public record IrProgram(List<IrNode> body) implements IrNode {

    public IrProgram {
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public <T, X extends Exception> T accept(IrVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
