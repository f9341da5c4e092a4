package org.callscript.compiler.util;

import org.callscript.compiler.frontend.lexer.Token;
import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.callscript.compiler.ir.IrCallExpression;
import org.callscript.compiler.ir.IrExpressionStatement;
import org.callscript.compiler.ir.IrIdentifier;
import org.callscript.compiler.ir.IrNode;
import org.callscript.compiler.ir.IrNumberLiteral;
import org.callscript.compiler.ir.IrProgram;
import org.callscript.compiler.ir.IrStringLiteral;
import org.callscript.compiler.ir.IrVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Utility class for rendering intermediate compiler artifacts as text, for debug logging.
 */
public final class DebugDump {

	private DebugDump() {}

	/**
	 * Renders a token list, one token per line.
	 * @param tokens The tokens.
	 * @return The rendered tokens.
	 */
	public static String dumpTokens(List<Token> tokens) {
		return tokens.stream()
				.map(t -> t.type() + " " + t.text())
				.collect(Collectors.joining("\n"));
	}

	/**
	 * Renders the source AST as an indented tree.
	 * @param root The root node.
	 * @return The rendered tree.
	 */
	public static String dumpAst(AstNode root) {
		StringBuilder sb = new StringBuilder();
		appendAst(sb, root, 0);
		return sb.toString().stripTrailing();
	}

	/**
	 * Renders the target AST as an indented tree.
	 * @param root The root node.
	 * @return The rendered tree.
	 */
	public static String dumpIr(IrNode root) {
		IrDumper dumper = new IrDumper();
		root.accept(dumper);
		return dumper.sb.toString().stripTrailing();
	}

	private static void appendAst(StringBuilder sb, AstNode node, int depth) {
		sb.append("  ".repeat(depth)).append(node.getClass().getSimpleName());
		if (node instanceof CallExpressionNode n) sb.append(' ').append(n.name());
		if (node instanceof NumberLiteralNode n) sb.append(' ').append(n.value());
		if (node instanceof StringLiteralNode n) sb.append(" \"").append(n.value()).append('"');
		sb.append('\n');
		for (AstNode child : node.getChildren()) {
			appendAst(sb, child, depth + 1);
		}
	}

	private static final class IrDumper implements IrVisitor<Void, RuntimeException> {

		private final StringBuilder sb = new StringBuilder();
		private int depth = 0;

		private void line(IrNode node, String detail) {
			sb.append("  ".repeat(depth)).append(node.getClass().getSimpleName()).append(detail).append('\n');
		}

		private void children(List<? extends IrNode> nodes) {
			depth++;
			for (IrNode child : nodes) child.accept(this);
			depth--;
		}

		@Override
		public Void visit(IrProgram node) {
			line(node, "");
			children(node.body());
			return null;
		}

		@Override
		public Void visit(IrExpressionStatement node) {
			line(node, "");
			children(List.of(node.expression()));
			return null;
		}

		@Override
		public Void visit(IrCallExpression node) {
			line(node, "");
			depth++;
			node.callee().accept(this);
			depth--;
			children(node.arguments());
			return null;
		}

		@Override
		public Void visit(IrIdentifier node) {
			line(node, " " + node.name());
			return null;
		}

		@Override
		public Void visit(IrNumberLiteral node) {
			line(node, " " + node.value());
			return null;
		}

		@Override
		public Void visit(IrStringLiteral node) {
			line(node, " \"" + node.value() + "\"");
			return null;
		}
	}
}
