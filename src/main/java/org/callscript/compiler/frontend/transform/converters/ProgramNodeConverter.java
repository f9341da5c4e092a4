package org.callscript.compiler.frontend.transform.converters;

import org.callscript.compiler.frontend.parser.ast.AstNode;
import org.callscript.compiler.frontend.parser.ast.ProgramNode;
import org.callscript.compiler.frontend.transform.IAstNodeConverter;
import org.callscript.compiler.frontend.transform.TransformContext;
import org.callscript.compiler.frontend.transform.TransformException;
import org.callscript.compiler.ir.IrProgram;

/**
 * Converts the root {@link ProgramNode} into an {@link IrProgram}.
 */
public final class ProgramNodeConverter implements IAstNodeConverter<ProgramNode, IrProgram> {

    /**
     * {@inheritDoc}
     * <p>
     * A program node is only valid as the root of the tree.
     */
    @Override
    public IrProgram convert(ProgramNode node, AstNode parent, TransformContext ctx) throws TransformException {
        if (parent != null) {
            throw ctx.error("ProgramNode is only valid as the root, but found below " + parent.getClass().getSimpleName() + ".");
        }
        return new IrProgram(ctx.convertAll(node.body(), node));
    }
}
