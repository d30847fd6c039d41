package dead.owner.jsunpack.utils.wrapper;

import com.google.javascript.rhino.Node;
import dead.owner.jsunpack.utils.AstUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Wrapper for a function node to provide utility methods
 */
public final class FunctionWrapper {
    private final Node functionNode;

    public FunctionWrapper(Node functionNode) {
        this.functionNode = functionNode;
    }

    /**
     * Get the name the function can be called by: its own name, or the variable it is stored in
     */
    public String getName() {
        String ownName = AstUtil.identifierOf(functionNode.getFirstChild());
        if (ownName != null) {
            return ownName;
        }

        Node parent = functionNode.getParent();
        if (parent != null && AstUtil.isDeclaredName(parent)) {
            return AstUtil.identifierOf(parent);
        }
        if (parent != null && parent.isAssign() && parent.getLastChild() == functionNode) {
            return AstUtil.identifierOf(parent.getFirstChild());
        }
        return null;
    }

    public int getParameterCount() {
        return functionNode.getSecondChild().getChildCount();
    }

    /**
     * Get the top-level statements of the body, with expression statements unwrapped.
     * Arrow functions with an expression body have none.
     */
    public List<Node> getBodyStatements() {
        List<Node> statements = new ArrayList<>();
        Node body = functionNode.getLastChild();
        if (!body.isBlock()) {
            return statements;
        }
        for (Node statement : body.children()) {
            statements.add(statement.isExprResult() ? statement.getFirstChild() : statement);
        }
        return statements;
    }
}
