package org.callscript.compiler.frontend.parser.ast;

import org.callscript.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a numeric literal.
 *
 * @param numberToken The token containing the number.
 */
public record NumberLiteralNode(
        Token numberToken
) implements AstNode {

    /**
     * Gets the digits of the literal exactly as written; no numeric conversion takes place.
     * @return The digit text.
     */
    public String value() {
        return numberToken.text();
    }

    @Override
    public <T, X extends Exception> T accept(AstVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
