package org.callscript.compiler.frontend.transform.converters;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.CallExpressionNode;
import org.callscript.compiler.frontend.transform.IAstNodeConverter;
import org.callscript.compiler.frontend.transform.TransformContext;
import org.callscript.compiler.frontend.transform.TransformException;
import org.callscript.compiler.ir.IrCallExpression;
import org.callscript.compiler.ir.IrExpressionStatement;
import org.callscript.compiler.ir.IrIdentifier;
import org.callscript.compiler.ir.IrNode;

/**
 * Converts {@link CallExpressionNode} into an {@link IrCallExpression} with an {@link IrIdentifier} callee.
 * Only calls nested in another call stay bare; all others are wrapped in an {@link IrExpressionStatement}.
 */
public final class CallExpressionNodeConverter implements IAstNodeConverter<CallExpressionNode, IrNode> {

    @Override
    public IrNode convert(CallExpressionNode node, AstNode parent, TransformContext ctx) throws TransformException {
        IrIdentifier callee = new IrIdentifier(node.name());
        IrCallExpression expression = new IrCallExpression(callee, ctx.convertAll(node.params(), node));

        if (parent instanceof CallExpressionNode) {
            return expression;
        }
        return new IrExpressionStatement(expression);
    }
}
