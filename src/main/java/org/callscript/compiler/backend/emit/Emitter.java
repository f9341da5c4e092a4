package org.callscript.compiler.backend.emit;

import org.callscript.compiler.api.CompilerErrorCode;
import org.callscript.compiler.ir.IrCallExpression;
import org.callscript.compiler.ir.IrExpressionStatement;
import org.callscript.compiler.ir.IrIdentifier;
import org.callscript.compiler.ir.IrNode;
import org.callscript.compiler.ir.IrNumberLiteral;
import org.callscript.compiler.ir.IrProgram;
import org.callscript.compiler.ir.IrStringLiteral;
import org.callscript.compiler.ir.IrVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The Emitter is the final stage of the compiler. It renders the target AST
 * as C-like call syntax, e.g. {@code add(2, subtract(4, 2));}.
 * <p>
 * Rendering is a pure function of the tree. The emitter holds no state and may be shared.
 */
public class Emitter {

    /**
     * Emits the text for the given target node and everything below it.
     *
     * @param node The node to render, normally an {@link IrProgram}.
     * @return The rendered text.
     * @throws CodeGenException if the node is null, or a program node appears below the root.
     */
    public String emit(IrNode node) throws CodeGenException {
        if (node == null) {
            throw new CodeGenException(CompilerErrorCode.UNHANDLED_NODE_KIND, "Cannot emit a null node.");
        }
        return node.accept(new Renderer(node));
    }

    private static final class Renderer implements IrVisitor<String, CodeGenException> {

        private final IrNode root;

        private Renderer(IrNode root) {
            this.root = root;
        }

        private String render(IrNode node) throws CodeGenException {
            if (node == null) {
                throw new CodeGenException(CompilerErrorCode.UNHANDLED_NODE_KIND, "Cannot emit a null node.");
            }
            return node.accept(this);
        }

        private String renderAll(List<IrNode> nodes, String separator) throws CodeGenException {
            List<String> parts = new ArrayList<>(nodes.size());
            for (IrNode node : nodes) {
                parts.add(render(node));
            }
            return String.join(separator, parts);
        }

        @Override
        public String visit(IrProgram node) throws CodeGenException {
            if (node != root) {
                throw new CodeGenException(CompilerErrorCode.UNHANDLED_NODE_KIND,
                        "IrProgram is only valid as the root of the target AST.");
            }
            return renderAll(node.body(), "\n");
        }

        @Override
        public String visit(IrExpressionStatement node) throws CodeGenException {
            return render(node.expression()) + ";";
        }

        @Override
        public String visit(IrCallExpression node) throws CodeGenException {
            return render(node.callee()) + "(" + renderAll(node.arguments(), ", ") + ")";
        }

        @Override
        public String visit(IrIdentifier node) {
            return node.name();
        }

        @Override
        public String visit(IrNumberLiteral node) {
            return node.value();
        }

        @Override
        public String visit(IrStringLiteral node) {
            return '"' + node.value() + '"';
        }
    }
}
