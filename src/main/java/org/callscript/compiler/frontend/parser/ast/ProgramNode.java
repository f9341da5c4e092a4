package org.callscript.compiler.frontend.parser.ast;

import java.util.List;

/**
 * The root of the source AST. There is exactly one per compilation.
 *
 * @param body The top-level expressions, in source order.
 */
public record ProgramNode(
        List<AstNode> body
) implements AstNode {

    /**
     * Compact constructor to ensure the body is never null and cannot change.
     */
    public ProgramNode {
        body = body == null ? List.of() : List.copyOf(body);
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }

    @Override
    public <T, X extends Exception> T accept(AstVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
