package org.callscript.compiler.frontend.transform.converters;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.StringLiteralNode;
import org.callscript.compiler.frontend.transform.IAstNodeConverter;
import org.callscript.compiler.frontend.transform.TransformContext;
import org.callscript.compiler.ir.IrStringLiteral;

/**
 * Converts {@link StringLiteralNode} into an {@link IrStringLiteral}.
 */
public final class StringLiteralNodeConverter implements IAstNodeConverter<StringLiteralNode, IrStringLiteral> {

    @Override
    public IrStringLiteral convert(StringLiteralNode node, AstNode parent, TransformContext ctx) {
        return new IrStringLiteral(node.value());
    }
}
