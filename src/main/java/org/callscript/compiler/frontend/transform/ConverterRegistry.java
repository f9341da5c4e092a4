package org.callscript.compiler.frontend.transform;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.AstVisitor;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.callscript.compiler.frontend.transform.converters.CallExpressionNodeConverter;
import org.callscript.compiler.frontend.transform.converters.NumberLiteralNodeConverter;
import org.callscript.compiler.frontend.transform.converters.ProgramNodeConverter;
import org.callscript.compiler.frontend.transform.converters.StringLiteralNodeConverter;
import org.callscript.compiler.ir.IrNode;
import org.callscript.compiler.ir.IrNumberLiteral;
import org.callscript.compiler.ir.IrProgram;
import org.callscript.compiler.ir.IrStringLiteral;

/**
 * Holds one converter per source AST node kind.
 * <p>
 * Unlike a class-keyed map, the registry has a slot for every kind of the sealed {@link AstNode}
 * hierarchy, and {@link #resolveAndConvert} dispatches through an {@link AstVisitor}; a missing
 * converter is a compile error rather than a runtime lookup miss.
 */
public final class ConverterRegistry {

	private final IAstNodeConverter<ProgramNode, IrProgram> programConverter;
	private final IAstNodeConverter<CallExpressionNode, IrNode> callExpressionConverter;
	private final IAstNodeConverter<NumberLiteralNode, IrNumberLiteral> numberLiteralConverter;
	private final IAstNodeConverter<StringLiteralNode, IrStringLiteral> stringLiteralConverter;

	/**
	 * Creates a registry with explicit converters for every node kind.
	 *
	 * @param programConverter        Converter for {@link ProgramNode}.
	 * @param callExpressionConverter Converter for {@link CallExpressionNode}.
	 * @param numberLiteralConverter  Converter for {@link NumberLiteralNode}.
	 * @param stringLiteralConverter  Converter for {@link StringLiteralNode}.
	 */
	public ConverterRegistry(IAstNodeConverter<ProgramNode, IrProgram> programConverter,
							 IAstNodeConverter<CallExpressionNode, IrNode> callExpressionConverter,
							 IAstNodeConverter<NumberLiteralNode, IrNumberLiteral> numberLiteralConverter,
							 IAstNodeConverter<StringLiteralNode, IrStringLiteral> stringLiteralConverter) {
		this.programConverter = programConverter;
		this.callExpressionConverter = callExpressionConverter;
		this.numberLiteralConverter = numberLiteralConverter;
		this.stringLiteralConverter = stringLiteralConverter;
	}

	/**
	 * Creates a registry with the built-in converters.
	 *
	 * @return A registry pre-populated with the standard converters.
	 */
	public static ConverterRegistry initializeWithDefaults() {
		return new ConverterRegistry(
				new ProgramNodeConverter(),
				new CallExpressionNodeConverter(),
				new NumberLiteralNodeConverter(),
				new StringLiteralNodeConverter());
	}

	/**
	 * Resolves the converter for the node's kind and invokes it.
	 *
	 * @param node   The node to convert.
	 * @param parent The source parent of the node, or null for the root.
	 * @param ctx    The transformation context.
	 * @return The target node built by the converter.
	 * @throws TransformException if the converter rejects the node.
	 */
	public IrNode resolveAndConvert(AstNode node, AstNode parent, TransformContext ctx) throws TransformException {
		return node.accept(new AstVisitor<IrNode, TransformException>() {
			@Override
			public IrNode visit(ProgramNode n) throws TransformException {
				return programConverter.convert(n, parent, ctx);
			}

			@Override
			public IrNode visit(CallExpressionNode n) throws TransformException {
				return callExpressionConverter.convert(n, parent, ctx);
			}

			@Override
			public IrNode visit(NumberLiteralNode n) throws TransformException {
				return numberLiteralConverter.convert(n, parent, ctx);
			}

			@Override
			public IrNode visit(StringLiteralNode n) throws TransformException {
				return stringLiteralConverter.convert(n, parent, ctx);
			}
		});
	}
}
