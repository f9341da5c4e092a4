package org.callscript.compiler.frontend.parser.ast;

import org.callscript.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * An AST node that represents a function application, {@code (name param...)}.
 *
 * @param nameToken The token right after the opening parenthesis.
 * @param params The nested expressions, in source order.
 */
public record CallExpressionNode(
        Token nameToken,
        List<AstNode> params
) implements AstNode {

    /**
     * Compact constructor to ensure the parameter list is never null and cannot change.
     */
    public CallExpressionNode {
        params = params == null ? List.of() : List.copyOf(params);
    }

    /**
     * @return The name of the called function.
     */
    public String name() {
        return nameToken.text();
    }

    @Override
    public List<AstNode> getChildren() {
        return params;
    }

    @Override
    public <T, X extends Exception> T accept(AstVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
