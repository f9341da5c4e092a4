package org.callscript.compiler.frontend;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.api.CompilerPhase;
import org.callscript.compiler.diagnostics.DiagnosticsEngine;
import org.callscript.compiler.frontend.lexer.Lexer;
import org.callscript.compiler.frontend.lexer.Token;
import org.callscript.compiler.frontend.lexer.TokenType;
import org.callscript.compiler.frontend.parser.Parser;
import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.transform.ConverterRegistry;
import org.callscript.compiler.frontend.transform.TransformException;
import org.callscript.compiler.frontend.transform.TransformListener;
import org.callscript.compiler.frontend.transform.Transformer;
import org.callscript.compiler.ir.IrCallExpression;
import org.callscript.compiler.ir.IrExpressionStatement;
import org.callscript.compiler.ir.IrIdentifier;
import org.callscript.compiler.ir.IrNode;
import org.callscript.compiler.ir.IrNumberLiteral;
import org.callscript.compiler.ir.IrProgram;
import org.callscript.compiler.ir.IrStringLiteral;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link Transformer}.
 * They check the shape of the target AST built from parsed sources and from hand-built trees.
 */
public class TransformerTest {

    private IrProgram transform(String source) throws Exception {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(source, diagnostics).scanTokens();
        ProgramNode ast = new Parser(tokens, diagnostics).parse();
        return new Transformer(diagnostics).transform(ast);
    }

    /**
     * Only the outermost call is wrapped in an {@link IrExpressionStatement}; the nested call
     * becomes a bare argument.
     */
    @Test
    @Tag("unit")
    void wrapsOnlyTopLevelCallsInStatements() throws Exception {
        IrProgram program = transform("(add 2 (subtract 4 2))");

        IrProgram expected = new IrProgram(List.of(
                new IrExpressionStatement(new IrCallExpression(new IrIdentifier("add"), List.of(
                        new IrNumberLiteral("2"),
                        new IrCallExpression(new IrIdentifier("subtract"), List.of(
                                new IrNumberLiteral("4"),
                                new IrNumberLiteral("2")))))))
        );
        assertThat(program).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void convertsStringLiteralsAndKeepsArgumentOrder() throws Exception {
        IrProgram program = transform("(concat \"foo\" 'bar' 1)");

        IrCallExpression call = (IrCallExpression) ((IrExpressionStatement) program.body().get(0)).expression();
        assertThat(call.callee().name()).isEqualTo("concat");
        assertThat(call.arguments()).containsExactly(
                new IrStringLiteral("foo"),
                new IrStringLiteral("bar"),
                new IrNumberLiteral("1"));
    }

    /**
     * Top-level literals are carried over as they are; they are not calls and get no statement wrapper.
     */
    @Test
    @Tag("unit")
    void topLevelLiteralsStayUnwrapped() throws Exception {
        IrProgram program = transform("42 (f)");

        assertThat(program.body()).hasSize(2);
        assertThat(program.body().get(0)).isEqualTo(new IrNumberLiteral("42"));
        assertThat(program.body().get(1)).isInstanceOf(IrExpressionStatement.class);
    }

    @Test
    @Tag("unit")
    void emptyProgramTransformsToEmptyProgram() throws Exception {
        assertThat(transform("").body()).isEmpty();
    }

    /**
     * Listeners see every node entered before its children (pre-order) and left after them.
     */
    @Test
    @Tag("unit")
    void listenersObservePreOrderTraversal() throws Exception {
        List<String> events = new ArrayList<>();
        TransformListener recorder = new TransformListener() {
            @Override
            public void enter(AstNode node, AstNode parent) {
                events.add("enter " + label(node));
            }

            @Override
            public void exit(AstNode node, AstNode parent, IrNode result) {
                events.add("exit " + label(node));
            }
        };
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode ast = new Parser(new Lexer("(a 1 (b 2))", diagnostics).scanTokens(), diagnostics).parse();

        new Transformer(diagnostics, ConverterRegistry.initializeWithDefaults(), List.of(recorder)).transform(ast);

        assertThat(events).containsExactly(
                "enter program",
                "enter a",
                "enter 1",
                "exit 1",
                "enter b",
                "enter 2",
                "exit 2",
                "exit b",
                "exit a",
                "exit program");
    }

    /**
     * A program node is only valid as the root; nesting one inside a call is an invariant violation.
     */
    @Test
    @Tag("unit")
    void nestedProgramNodeIsRejected() {
        CallExpressionNode call = new CallExpressionNode(
                new Token(TokenType.NAME, "f"),
                List.of(new ProgramNode(List.of())));
        ProgramNode ast = new ProgramNode(List.of(call));
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThatThrownBy(() -> new Transformer(diagnostics).transform(ast, "nested"))
                .isInstanceOf(TransformException.class)
                .satisfies(e -> {
                    TransformException ex = (TransformException) e;
                    assertThat(ex.errorCode()).isEqualTo(CompilerErrorCode.UNHANDLED_NODE_KIND);
                    assertThat(ex.phase()).isEqualTo(CompilerPhase.TRANSFORMATION);
                });
        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.programName()).isEqualTo("nested"));
    }

    @Test
    @Tag("unit")
    void sourceTreeIsLeftUntouched() throws Exception {
        NumberLiteralNode one = new NumberLiteralNode(new Token(TokenType.NUMBER, "1"));
        CallExpressionNode call = new CallExpressionNode(new Token(TokenType.NAME, "f"), List.of(one));
        ProgramNode ast = new ProgramNode(List.of(call));

        new Transformer(new DiagnosticsEngine()).transform(ast);

        assertThat(ast.body()).containsExactly(call);
        assertThat(call.params()).containsExactly(one);
    }

    private static String label(AstNode node) {
        if (node instanceof ProgramNode) return "program";
        if (node instanceof CallExpressionNode c) return c.name();
        if (node instanceof NumberLiteralNode n) return n.value();
        return node.toString();
    }
}
