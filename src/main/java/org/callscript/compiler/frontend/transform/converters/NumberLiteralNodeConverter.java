package org.callscript.compiler.frontend.transform.converters;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.NumberLiteralNode;
import org.callscript.compiler.frontend.transform.IAstNodeConverter;
import org.callscript.compiler.frontend.transform.TransformContext;
import org.callscript.compiler.ir.IrNumberLiteral;

/**
 * Converts {@link NumberLiteralNode} into an {@link IrNumberLiteral}, keeping the digit text.
 */
public final class NumberLiteralNodeConverter implements IAstNodeConverter<NumberLiteralNode, IrNumberLiteral> {

    @Override
    public IrNumberLiteral convert(NumberLiteralNode node, AstNode parent, TransformContext ctx) {
        return new IrNumberLiteral(node.value());
    }
}
