package dead.owner.jsunpack.utils;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Utility class for AST shape checks
 */
public final class AstUtil {

    private static final Set<Token> ASSIGNMENTS = EnumSet.of(
            Token.ASSIGN, Token.ASSIGN_BITOR, Token.ASSIGN_BITXOR, Token.ASSIGN_BITAND,
            Token.ASSIGN_LSH, Token.ASSIGN_RSH, Token.ASSIGN_URSH,
            Token.ASSIGN_ADD, Token.ASSIGN_SUB, Token.ASSIGN_MUL, Token.ASSIGN_DIV, Token.ASSIGN_MOD,
            Token.ASSIGN_EXPONENT, Token.ASSIGN_OR, Token.ASSIGN_AND, Token.ASSIGN_COALESCE);

    private static final Set<Token> LOOPS = EnumSet.of(
            Token.FOR, Token.FOR_IN, Token.FOR_OF, Token.FOR_AWAIT_OF, Token.WHILE, Token.DO);

    private static final Set<Token> DECLARATIONS = EnumSet.of(Token.VAR, Token.LET, Token.CONST);

    private AstUtil() {
    }

    /**
     * Visit {@code root} and its descendants in document order. Returning false skips the children of a node.
     */
    public static void walk(Node root, Predicate<Node> visitor) {
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            if (!visitor.test(node)) {
                continue;
            }
            for (Node child = node.getLastChild(); child != null; child = child.getPrevious()) {
                pending.push(child);
            }
        }
    }

    /**
     * Get the identifier of a name node, or null if the node is not a plain name
     */
    public static String identifierOf(Node node) {
        if (node == null || !node.isName() || node.getString().isEmpty()) {
            return null;
        }
        return node.getString();
    }

    public static boolean isName(Node node, String identifier) {
        return identifier.equals(identifierOf(node));
    }

    /**
     * Check if the node is the member access {@code object.property}
     */
    public static boolean isMemberAccess(Node node, String object, String property) {
        return property.equals(memberOf(node, object));
    }

    /**
     * Get the property name of {@code object.property}, or null for any other shape
     */
    public static String memberOf(Node node, String object) {
        if (node != null && node.isGetProp() && isName(node.getFirstChild(), object)) {
            return node.getString();
        }
        return null;
    }

    /**
     * Get the value of a numeric literal, also accepting a negated one ({@code -1})
     */
    public static Optional<Double> numberOf(Node node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.isNumber()) {
            return Optional.of(node.getDouble());
        }
        if (node.getToken() == Token.NEG && node.getFirstChild().isNumber()) {
            return Optional.of(-node.getFirstChild().getDouble());
        }
        return Optional.empty();
    }

    /**
     * Get the value of a numeric literal if it is an exact int
     */
    public static Optional<Integer> integerOf(Node node) {
        return numberOf(node).flatMap(AstUtil::toExactInt);
    }

    public static Optional<Integer> toExactInt(double value) {
        if (value == Math.rint(value) && value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return Optional.of((int) value);
        }
        return Optional.empty();
    }

    public static boolean isDeclaration(Node node) {
        return node != null && DECLARATIONS.contains(node.getToken());
    }

    /**
     * Check if the name node is the target of a {@code var}, {@code let} or {@code const}
     */
    public static boolean isDeclaredName(Node node) {
        return node.isName() && isDeclaration(node.getParent());
    }

    public static boolean isAssignment(Node node) {
        return node != null && ASSIGNMENTS.contains(node.getToken());
    }

    public static boolean isUpdate(Node node) {
        return node != null && (node.getToken() == Token.INC || node.getToken() == Token.DEC);
    }

    public static boolean isLoop(Node node) {
        return node != null && LOOPS.contains(node.getToken());
    }

    /**
     * Check if a statement can be replaced by several statements without changing what encloses it.
     * Case bodies are blocks the parser adds, single-statement loop and branch bodies are too.
     */
    public static boolean isStatementList(Node node) {
        if (node == null) {
            return false;
        }
        if (node.isScript() || node.getToken() == Token.MODULE_BODY) {
            return true;
        }
        if (!node.isBlock()) {
            return false;
        }
        Node parent = node.getParent();
        return !node.isAddedBlock() || parent != null && (parent.isCase() || parent.isDefaultCase());
    }

    /**
     * Get the statements directly inside a block, or the node itself if it is a single statement
     */
    public static List<Node> statementsOf(Node node) {
        List<Node> statements = new ArrayList<>();
        if (node == null) {
            return statements;
        }
        if (node.isBlock() || node.isScript() || node.getToken() == Token.MODULE_BODY) {
            for (Node child : node.children()) {
                statements.add(child);
            }
        } else {
            statements.add(node);
        }
        return statements;
    }

    /**
     * Collect every name written anywhere other than its own plain declaration:
     * assignment targets, {@code ++}/{@code --} operands, for-in/of variables and destructured names
     */
    public static Set<String> reassignedNames(Node root) {
        Set<String> names = new HashSet<>();

        walk(root, node -> {
            if (isAssignment(node) || isUpdate(node)) {
                addTargetNames(names, node.getFirstChild());
            } else if (node.getToken() == Token.FOR_IN || node.getToken() == Token.FOR_OF
                    || node.getToken() == Token.FOR_AWAIT_OF) {
                Node iterator = node.getFirstChild();
                if (isDeclaration(iterator)) {
                    for (Node variable : iterator.children()) {
                        addTargetNames(names, variable);
                    }
                } else {
                    addTargetNames(names, iterator);
                }
            } else if (node.getToken() == Token.DESTRUCTURING_LHS) {
                addTargetNames(names, node.getFirstChild());
            }
            return true;
        });

        return names;
    }

    /**
     * Add a plain target, or every name inside a destructuring pattern
     */
    private static void addTargetNames(Set<String> names, Node target) {
        if (target == null) {
            return;
        }
        if (target.isName()) {
            String name = identifierOf(target);
            if (name != null) {
                names.add(name);
            }
            return;
        }
        if (target.getToken() == Token.ARRAY_PATTERN || target.getToken() == Token.OBJECT_PATTERN
                || target.getToken() == Token.DESTRUCTURING_LHS) {
            walk(target, node -> {
                String name = identifierOf(node);
                if (name != null) {
                    names.add(name);
                }
                return true;
            });
        }
    }
}
