package org.callscript.compiler.frontend.parser;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;
import org.callscript.compiler.config.CompilerOptions;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.lexer.Token;
import org.callscript.compiler.frontend.lexer.TokenType;
import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.parser.ast.StringLiteralNode;

import java.util.ArrayList;
import java.util.List;

/**
 * The recursive descent parser. It consumes a list of tokens
 * from the {@link org.callscript.compiler.frontend.lexer.Lexer} and produces the source Abstract Syntax Tree (AST).
 * <p>
 * The parser owns its cursor and looks at most one token ahead; an instance is meant
 * to be used for a single {@link #parse()} call.
 * Call nesting is limited by {@link CompilerOptions#maxDepth()}, which bounds the recursion
 * of this and every later phase.
 */
public class Parser {

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final CompilerOptions options;
    private final String programName;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser with the default options.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this(tokens, diagnostics, CompilerOptions.defaults(), "<memory>");
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors and warnings.
     * @param options The compiler options; decides how a non-name callee is treated.
     * @param programName The name of the program, for error reporting.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics, CompilerOptions options, String programName) {
        this.tokens = tokens;
        this.diagnostics = diagnostics;
        this.options = options;
        this.programName = programName;
    }

    /**
     * Parses the entire token stream.
     * @return The program node holding the top-level expressions in order.
     * @throws ParseException on the first malformed or unbalanced expression.
     */
    public ProgramNode parse() throws ParseException {
        List<AstNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(expression());
        }
        return new ProgramNode(body);
    }

    private AstNode expression() throws ParseException {
        if (isAtEnd()) {
            throw error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT, "Unexpected end of input while parsing expression.");
        }

        if (match(TokenType.NUMBER)) return new NumberLiteralNode(previous());

        if (match(TokenType.STRING)) return new StringLiteralNode(previous());

        if (checkParen("(")) {
            advance();
            return callExpression();
        }

        Token unexpected = advance();
        throw error(CompilerErrorCode.UNEXPECTED_TOKEN, "Unexpected token while parsing expression: " + unexpected.describe());
    }

    private CallExpressionNode callExpression() throws ParseException {
        if (depth >= options.maxDepth()) {
            throw error(CompilerErrorCode.NESTING_TOO_DEEP,
                    "Call nesting exceeds the maximum depth of " + options.maxDepth() + ".");
        }
        depth++;
        try {
            return callBody();
        } finally {
            depth--;
        }
    }

    private CallExpressionNode callBody() throws ParseException {
        Token callee = callee();

        List<AstNode> params = new ArrayList<>();
        while (!checkParen(")")) {
            if (isAtEnd()) {
                throw error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT,
                        "Unexpected end of input: call '" + callee.text() + "' is missing its closing ')'.");
            }
            params.add(expression());
        }

        // The closing ')'
        advance();
        return new CallExpressionNode(callee, params);
    }

    private Token callee() throws ParseException {
        if (isAtEnd()) {
            throw error(CompilerErrorCode.UNEXPECTED_END_OF_INPUT, "Unexpected end of input: expected a function name after '('.");
        }

        Token callee = advance();
        if (callee.type() == TokenType.NAME) {
            return callee;
        }

        if (options.strictCallee()) {
            throw error(CompilerErrorCode.INVALID_CALLEE, "Expected a function name after '(', but got " + callee.describe() + ".");
        }
        diagnostics.reportWarning(CompilerPhase.PARSING,
                "Using " + callee.describe() + " as function name.", programName);
        return callee;
    }

    private ParseException error(CompilerErrorCode code, String message) {
        diagnostics.reportError(CompilerPhase.PARSING, message, programName);
        return new ParseException(code, message);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private boolean checkParen(String paren) {
        if (isAtEnd()) return false;
        return peek().isParen(paren);
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() {
        return current >= tokens.size();
    }

    private Token peek() {
        return tokens.get(current);
    }

    private Token previous() {
        return tokens.get(current - 1);
    }
}
