package org.callscript.compiler.frontend.lexer;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (paren, number, string or name).
 * @param text The text of the token. For strings this is the content without the quotes.
 */
public record Token(
        TokenType type,
        String text
) {

    /**
     * Checks whether this token is the given parenthesis.
     * @param paren Either "(" or ")".
     * @return true if this is a {@link TokenType#PAREN} token with that text.
     */
    public boolean isParen(String paren) {
        return type == TokenType.PAREN && text.equals(paren);
    }

    /**
     * @return A short description for error messages, e.g. {@code NAME 'add'}.
     */
    public String describe() {
        return type + " '" + text + "'";
    }
}
