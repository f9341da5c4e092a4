package org.callscript.compiler.frontend.lexer;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * It scans once from left to right without backtracking and stops at the first error.
 * An instance is meant to be used for a single {@link #scanTokens()} call.
 */
public class Lexer {

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String programName;
    private int start = 0;
    private int current = 0;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit program name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param programName The name of the program, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String programName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.programName = programName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, in source order.
     * @throws LexException on the first character that does not start a token, or an unclosed string.
     */
    public List<Token> scanTokens() throws LexException {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        return tokens;
    }

    private void scanToken() throws LexException {
        char c = advance();
        switch (c) {
            case '(', ')': addToken(TokenType.PAREN, String.valueOf(c)); break;
            case '"', '\'': string(c); break;
            default:
                if (isWhitespace(c)) {
                    break;
                }
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    name();
                } else {
                    throw error(CompilerErrorCode.UNEXPECTED_CHARACTER,
                            "Unexpected character: '" + c + "'");
                }
                break;
        }
    }

    private void number() {
        while (isDigit(peek())) advance();
        addToken(TokenType.NUMBER, source.substring(start, current));
    }

    private void name() {
        while (isAlpha(peek())) advance();
        addToken(TokenType.NAME, source.substring(start, current));
    }

    private void string(char quote) throws LexException {
        while (!isAtEnd() && peek() != quote) {
            advance();
        }

        if (isAtEnd()) {
            throw error(CompilerErrorCode.UNTERMINATED_STRING,
                    "Unterminated string: " + source.substring(start) + " is missing its closing " + quote);
        }

        // The closing quote
        advance();

        addToken(TokenType.STRING, source.substring(start + 1, current - 1));
    }

    private LexException error(CompilerErrorCode code, String message) {
        diagnostics.reportError(CompilerPhase.LEXING, message, programName);
        return new LexException(code, message);
    }

    private void addToken(TokenType type, String text) {
        tokens.add(new Token(type, text));
    }

    private char advance() {
        return source.charAt(current++);
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    // Unicode space separators such as U+00A0 are whitespace too.
    private boolean isWhitespace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z');
    }
}
