package org.callscript.compiler.frontend;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.config.CompilerOptions;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.lexer.Lexer;
import org.callscript.compiler.frontend.lexer.Token;
import org.callscript.compiler.frontend.lexer.TokenType;
import org.callscript.compiler.frontend.parser.ParseException;
import org.callscript.compiler.frontend.parser.Parser;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Parser}.
 * These tests verify that the parser turns a token stream into the source AST and reports
 * malformed or unbalanced call expressions.
 */
public class ParserTest {

    private static final CompilerOptions STRICT = CompilerOptions.defaults();
    private static final CompilerOptions PERMISSIVE = CompilerOptions.defaults().withStrictCallee(false);

    private ProgramNode parse(String source, CompilerOptions options, DiagnosticsEngine diagnostics) throws Exception {
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        return new Parser(tokens, diagnostics, options, "test").parse();
    }

    private ProgramNode parse(String source) throws Exception {
        return parse(source, STRICT, new DiagnosticsEngine());
    }

    /**
     * Verifies that the parser builds a {@link CallExpressionNode} with its literal and nested call
     * parameters in source order.
     */
    @Test
    @Tag("unit")
    void testParserNestedCall() throws Exception {
        // Act
        ProgramNode program = parse("(add 2 (subtract 4 \"x\"))");

        // Assert
        assertThat(program.body()).hasSize(1);
        assertThat(program.body().get(0)).isInstanceOf(CallExpressionNode.class);

        CallExpressionNode add = (CallExpressionNode) program.body().get(0);
        assertThat(add.name()).isEqualTo("add");
        assertThat(add.params()).hasSize(2);
        assertThat(add.params().get(0)).isInstanceOf(NumberLiteralNode.class);
        assertThat(((NumberLiteralNode) add.params().get(0)).value()).isEqualTo("2");

        CallExpressionNode subtract = (CallExpressionNode) add.params().get(1);
        assertThat(subtract.name()).isEqualTo("subtract");
        assertThat(subtract.params()).hasSize(2);
        assertThat(((NumberLiteralNode) subtract.params().get(0)).value()).isEqualTo("4");
        assertThat(((StringLiteralNode) subtract.params().get(1)).value()).isEqualTo("x");
    }

    @Test
    @Tag("unit")
    void parsesMultipleTopLevelExpressions() throws Exception {
        ProgramNode program = parse("(a 1) (b 2) 3 \"s\"");

        assertThat(program.body()).hasSize(4);
        assertThat(program.body().get(0)).isInstanceOf(CallExpressionNode.class);
        assertThat(program.body().get(1)).isInstanceOf(CallExpressionNode.class);
        assertThat(program.body().get(2)).isInstanceOf(NumberLiteralNode.class);
        assertThat(program.body().get(3)).isInstanceOf(StringLiteralNode.class);
    }

    @Test
    @Tag("unit")
    void parsesCallWithoutParameters() throws Exception {
        ProgramNode program = parse("(now)");

        CallExpressionNode call = (CallExpressionNode) program.body().get(0);
        assertThat(call.name()).isEqualTo("now");
        assertThat(call.params()).isEmpty();
    }

    @Test
    @Tag("unit")
    void emptyInputGivesEmptyProgram() throws Exception {
        assertThat(parse("").body()).isEmpty();
    }

    @Test
    @Tag("unit")
    void unbalancedCallFailsWithEndOfInput() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThatThrownBy(() -> parse("(add 2", STRICT, diagnostics))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_END_OF_INPUT);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    @Test
    @Tag("unit")
    void missingCalleeFailsWithEndOfInputInBothModes() {
        assertThatThrownBy(() -> parse("(", STRICT, new DiagnosticsEngine()))
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_END_OF_INPUT);
        assertThatThrownBy(() -> parse("(", PERMISSIVE, new DiagnosticsEngine()))
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_END_OF_INPUT);
    }

    @Test
    @Tag("unit")
    void strayClosingParenIsUnexpected() {
        assertThatThrownBy(() -> parse("(a 1))"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining(")")
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
    }

    /**
     * A bare name is only valid right after '('; as an argument it has no meaning.
     */
    @Test
    @Tag("unit")
    void nameInArgumentPositionIsUnexpected() {
        assertThatThrownBy(() -> parse("(add x 1)"))
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.UNEXPECTED_TOKEN);
    }

    @Test
    @Tag("unit")
    void strictModeRejectsNonNameCallee() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThatThrownBy(() -> parse("(2 3)", STRICT, diagnostics))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("NUMBER '2'")
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.INVALID_CALLEE);
    }

    /**
     * In permissive mode the token text becomes the callee name and a warning is recorded.
     */
    @Test
    @Tag("unit")
    void permissiveModeAcceptsNonNameCalleeWithWarning() throws Exception {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        ProgramNode program = parse("(2 3)", PERMISSIVE, diagnostics);

        CallExpressionNode call = (CallExpressionNode) program.body().get(0);
        assertThat(call.name()).isEqualTo("2");
        assertThat(call.nameToken().type()).isEqualTo(TokenType.NUMBER);
        assertThat(call.params()).hasSize(1);
        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.warnings()).hasSize(1);
        assertThat(diagnostics.warnings().get(0).message()).contains("NUMBER '2'");
    }

    @Test
    @Tag("unit")
    void acceptsNestingUpToTheConfiguredDepth() throws Exception {
        CompilerOptions shallow = STRICT.withMaxDepth(3);

        ProgramNode program = parse("(a (b (c 1)) (d 2))", shallow, new DiagnosticsEngine());

        CallExpressionNode a = (CallExpressionNode) program.body().get(0);
        CallExpressionNode b = (CallExpressionNode) a.params().get(0);
        assertThat(((CallExpressionNode) b.params().get(0)).name()).isEqualTo("c");
        assertThat(((CallExpressionNode) a.params().get(1)).name()).isEqualTo("d");
    }

    @Test
    @Tag("unit")
    void rejectsNestingBeyondTheConfiguredDepth() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThatThrownBy(() -> parse("(a (b (c (d 1))))", STRICT.withMaxDepth(3), diagnostics))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.NESTING_TOO_DEEP);
        assertThat(diagnostics.hasErrors()).isTrue();
    }

    /**
     * Input nested far deeper than any stack could recurse fails with a compilation error, not a stack overflow.
     */
    @Test
    @Tag("unit")
    void veryDeepNestingFailsWithParseError() {
        String source = "(f ".repeat(100_000) + "1" + ")".repeat(100_000);

        assertThatThrownBy(() -> parse(source))
                .isInstanceOf(ParseException.class)
                .extracting(e -> ((ParseException) e).errorCode())
                .isEqualTo(CompilerErrorCode.NESTING_TOO_DEEP);
    }
}
