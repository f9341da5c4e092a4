package org.callscript.compiler.frontend.parser.ast;

import org.callscript.compiler.frontend.lexer.Token;

/**
 * An AST node that represents a string literal.
 *
 * @param stringToken The token containing the string content.
 */
public record StringLiteralNode(
        Token stringToken
) implements AstNode {

    /**
     * @return The string content without quotes.
     */
    public String value() {
        return stringToken.text();
    }

    @Override
    public <T, X extends Exception> T accept(AstVisitor<T, X> visitor) throws X {
        return visitor.visit(this);
    }
}
