package dead.owner.jsunpack.transformers;

import com.google.javascript.rhino.Node;
import com.google.javascript.rhino.Token;
import dead.owner.jsunpack.Run;
import dead.owner.jsunpack.transformers.scope.Binding;
import dead.owner.jsunpack.transformers.scope.Scope;
import dead.owner.jsunpack.utils.AstUtil;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.wrapper.FunctionWrapper;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Transformer to restore the execution order of switch dispatch loops scrambled through array swaps.
 * <p>
 * The obfuscated shape:
 * <pre>
 *     var order = [2, 0, 1, 3];
 *     function swap(a, i, j) { var t = a[i]; a[i] = a[j]; a[j] = t; }
 *     swap(order, 0, 3);                  // order is now [3, 0, 1, 2]
 *     for (var step of order) {
 *         switch (step) { case 0: ...; break; case 1: ...; break; ... }
 *     }
 * </pre>
 * The loop is replaced by the case bodies in the order the modeled array holds when the loop is reached.
 * Cases whose value never occurs in the array, and the default case, are not reproduced.
 * An array that is used in any other way than reading it, swapping it or iterating it is no longer modeled.
 */
public class SwitchOrderRestorer implements Transformer {

    /**
     * Statements that need a semicolon to end when another statement follows
     */
    private static final Set<Token> SIMPLE_STATEMENTS = EnumSet.of(
            Token.EXPR_RESULT, Token.VAR, Token.LET, Token.CONST, Token.RETURN, Token.THROW,
            Token.BREAK, Token.CONTINUE, Token.DO, Token.DEBUGGER);

    /**
     * Targets of a write that can hold an element or property access
     */
    private static final Set<Token> PATTERN_TARGETS = EnumSet.of(
            Token.ARRAY_PATTERN, Token.OBJECT_PATTERN, Token.STRING_KEY, Token.DEFAULT_VALUE,
            Token.ITER_REST, Token.OBJECT_REST);

    @Override
    public List<Replacement> transform(ScriptSnapshot snapshot) {
        RestoreState state = new RestoreState(AstUtil.reassignedNames(snapshot.getBody()));

        snapshot.visit(node -> {
            if (AstUtil.isDeclaredName(node)) {
                trackDeclaration(node, state);
            } else if (node.isName()) {
                checkArrayUse(node, state);
            } else if (node.isFunction()) {
                trackSwapFunction(new FunctionWrapper(node), state);
            } else if (node.isCall()) {
                replaySwap(node, state);
            } else if (node.isForOf()) {
                Optional<Replacement> replacement = restoreLoop(snapshot, node, state.scope);
                if (replacement.isPresent()) {
                    state.replacements.add(replacement.get());
                    // The whole loop is rewritten, nothing inside it can be edited separately
                    return false;
                }
            }
            return true;
        });

        if (!state.replacements.isEmpty()) {
            Run.log(getClass().getSimpleName() + " | Restored " + state.replacements.size() + " dispatch loops");
        }
        return state.replacements;
    }

    /**
     * Track integer array literals and numeric constants usable as swap indices
     */
    private void trackDeclaration(Node declared, RestoreState state) {
        String name = AstUtil.identifierOf(declared);
        if (name == null) {
            return;
        }
        if (state.reassigned.contains(name)) {
            state.scope.unbind(name);
            return;
        }

        Node value = declared.getFirstChild();
        if (value != null && value.isArrayLit()) {
            Optional<List<Integer>> sequence = integerElements(value);
            if (sequence.isPresent()) {
                state.scope.bind(name, new Binding.ArrayBinding(sequence.get()));
                return;
            }
        }

        Optional<Double> number = AstUtil.numberOf(value);
        if (number.isPresent()) {
            state.scope.bind(name, new Binding.Literal(number.get()));
        } else if (value == null || !value.isFunction()) {
            // A function initializer is bound when the function node itself is visited
            state.scope.unbind(name);
        }
    }

    private Optional<List<Integer>> integerElements(Node array) {
        List<Integer> sequence = new ArrayList<>();
        for (Node element : array.children()) {
            Optional<Integer> value = AstUtil.integerOf(element);
            if (value.isEmpty()) {
                return Optional.empty();
            }
            sequence.add(value.get());
        }
        return Optional.of(sequence);
    }

    /**
     * Stop modeling an array when a reference to it could change its contents or leak it.
     * Reading an element or a property, passing it first to a swap and iterating it are the only safe uses.
     */
    private void checkArrayUse(Node name, RestoreState state) {
        String identifier = AstUtil.identifierOf(name);
        if (identifier == null || state.scope.lookup(identifier, Binding.ArrayBinding.class).isEmpty()) {
            return;
        }
        if (isShadowedParameter(name, identifier) || isSafeUse(name, state.scope)) {
            return;
        }

        Run.log(getClass().getSimpleName() + " | " + identifier + " may be modified outside a swap, no longer tracking it");
        state.scope.unbind(identifier);
    }

    private boolean isSafeUse(Node name, Scope scope) {
        Node parent = name.getParent();
        if (parent == null) {
            return false;
        }
        if (parent.isForOf() && parent.getSecondChild() == name) {
            return true;
        }
        if (parent.isCall() && parent.getSecondChild() == name) {
            return isSwapCall(parent, scope);
        }
        if ((parent.isGetElem() || parent.isGetProp()) && parent.getFirstChild() == name) {
            return isRead(parent);
        }
        return false;
    }

    /**
     * Check that an element or property access is only read, never written, updated, deleted or called
     */
    private boolean isRead(Node access) {
        Node parent = access.getParent();
        if (parent == null) {
            return true;
        }
        if (parent.getFirstChild() == access
                && (AstUtil.isAssignment(parent) || AstUtil.isUpdate(parent) || parent.isCall()
                || parent.isForIn() || parent.isForOf())) {
            return false;
        }
        return !parent.isDelProp() && !PATTERN_TARGETS.contains(parent.getToken());
    }

    /**
     * Check if the name refers to a parameter of an enclosing function rather than the tracked array
     */
    private boolean isShadowedParameter(Node name, String identifier) {
        for (Node current = name.getParent(); current != null; current = current.getParent()) {
            if (current.isFunction() && declaresParameter(current, identifier)) {
                return true;
            }
        }
        return false;
    }

    private boolean declaresParameter(Node function, String identifier) {
        boolean[] found = {false};
        AstUtil.walk(function.getSecondChild(), node -> {
            if (AstUtil.isName(node, identifier)) {
                found[0] = true;
            }
            return !found[0];
        });
        return found[0];
    }

    /**
     * Mark 3-parameter functions that capture one indexed element and assign two
     */
    private void trackSwapFunction(FunctionWrapper function, RestoreState state) {
        String name = function.getName();
        if (name == null || function.getParameterCount() != 3) {
            return;
        }

        int captures = 0;
        int assignments = 0;
        for (Node statement : function.getBodyStatements()) {
            if (AstUtil.isDeclaration(statement)) {
                for (Node variable : statement.children()) {
                    if (variable.isName() && variable.getFirstChild() != null && variable.getFirstChild().isGetElem()) {
                        captures++;
                    }
                }
            } else if (statement.isAssign() && statement.getFirstChild().isGetElem()) {
                assignments++;
            }
        }

        if (captures >= 1 && assignments >= 2) {
            state.scope.bind(name, new Binding.SwapFunctionMarker(name));
        }
    }

    private boolean isSwapCall(Node call, Scope scope) {
        String functionName = AstUtil.identifierOf(call.getFirstChild());
        return functionName != null
                && call.getChildCount() == 4
                && scope.lookup(functionName, Binding.SwapFunctionMarker.class).isPresent();
    }

    /**
     * Apply a {@code swap(array, i, j)} call to the modeled array.
     * If an index cannot be determined the array is no longer tracked.
     */
    private void replaySwap(Node call, RestoreState state) {
        if (!isSwapCall(call, state.scope)) {
            return;
        }

        Node arrayArgument = call.getSecondChild();
        String arrayName = AstUtil.identifierOf(arrayArgument);
        if (arrayName == null) {
            return;
        }
        Optional<Binding.ArrayBinding> array = state.scope.lookup(arrayName, Binding.ArrayBinding.class);
        if (array.isEmpty()) {
            return;
        }

        Optional<Integer> first = constantIndex(arrayArgument.getNext(), state.scope);
        Optional<Integer> second = constantIndex(arrayArgument.getNext().getNext(), state.scope);
        // A swap inside a loop runs an unknown number of times
        if (isInsideLoop(call) || first.isEmpty() || second.isEmpty()
                || !array.get().inBounds(first.get()) || !array.get().inBounds(second.get())) {
            Run.log(getClass().getSimpleName() + " | Unresolvable swap on " + arrayName + ", no longer tracking it");
            state.scope.unbind(arrayName);
            return;
        }

        state.scope.bind(arrayName, array.get().swap(first.get(), second.get()));
    }

    private boolean isInsideLoop(Node node) {
        for (Node current = node.getParent(); current != null; current = current.getParent()) {
            if (AstUtil.isLoop(current)) {
                return true;
            }
            if (current.isFunction()) {
                return false;
            }
        }
        return false;
    }

    private Optional<Integer> constantIndex(Node argument, Scope scope) {
        Optional<Integer> literal = AstUtil.integerOf(argument);
        if (literal.isPresent()) {
            return literal;
        }

        String name = AstUtil.identifierOf(argument);
        if (name == null) {
            return Optional.empty();
        }
        return scope.lookup(name, Binding.Literal.class)
                .map(Binding.Literal::value)
                .filter(Double.class::isInstance)
                .flatMap(value -> AstUtil.toExactInt((Double) value));
    }

    /**
     * Replace a {@code for (v of array) switch (v) {...}} loop by its cases in modeled order
     */
    private Optional<Replacement> restoreLoop(ScriptSnapshot snapshot, Node loop, Scope scope) {
        String arrayName = AstUtil.identifierOf(loop.getSecondChild());
        if (arrayName == null) {
            return Optional.empty();
        }
        Optional<Binding.ArrayBinding> array = scope.lookup(arrayName, Binding.ArrayBinding.class);
        if (array.isEmpty()) {
            return Optional.empty();
        }

        String loopVariable = loopVariableOf(loop);
        if (loopVariable == null) {
            return Optional.empty();
        }

        Node body = loop.getLastChild();
        if (references(body, arrayName)) {
            Run.log(getClass().getSimpleName() + " | Loop over " + arrayName + " uses the array in its body, skipping");
            return Optional.empty();
        }

        Node dispatch = findDispatch(body, loopVariable);
        if (dispatch == null) {
            return Optional.empty();
        }

        Optional<String> restored = reorder(snapshot, dispatch, array.get().sequence());
        if (restored.isEmpty()) {
            return Optional.empty();
        }

        Run.log(getClass().getSimpleName() + " | Restored loop over " + arrayName + " as " + array.get().sequence());
        String text = AstUtil.isStatementList(loop.getParent()) ? restored.get() : "{\n" + restored.get() + "}";
        return Optional.of(snapshot.replace(loop, text));
    }

    private String loopVariableOf(Node loop) {
        Node iterator = loop.getFirstChild();
        if (AstUtil.isDeclaration(iterator)) {
            return iterator.hasOneChild() ? AstUtil.identifierOf(iterator.getFirstChild()) : null;
        }
        return AstUtil.identifierOf(iterator);
    }

    private boolean references(Node root, String identifier) {
        boolean[] found = {false};
        AstUtil.walk(root, node -> {
            if (AstUtil.isName(node, identifier)) {
                found[0] = true;
            }
            return !found[0];
        });
        return found[0];
    }

    /**
     * Find the switch on the loop variable, as the loop body or the only statement one block level deep
     */
    private Node findDispatch(Node body, String loopVariable) {
        List<Node> statements = significantStatements(body);
        if (statements.size() != 1) {
            return null;
        }

        Node statement = statements.get(0);
        if (statement.isBlock()) {
            List<Node> inner = significantStatements(statement);
            if (inner.size() != 1) {
                return null;
            }
            statement = inner.get(0);
        }

        if (statement.isSwitch() && AstUtil.isName(statement.getFirstChild(), loopVariable)) {
            return statement;
        }
        return null;
    }

    private List<Node> significantStatements(Node node) {
        return AstUtil.statementsOf(node).stream()
                .filter(statement -> !statement.isEmpty())
                .collect(Collectors.toList());
    }

    /**
     * Get the case clauses of a switch in source order
     */
    private List<Node> casesOf(Node dispatch) {
        List<Node> cases = new ArrayList<>();
        for (Node child = dispatch.getSecondChild(); child != null; child = child.getNext()) {
            if (child.isCase() || child.isDefaultCase()) {
                cases.add(child);
            } else {
                for (Node nested : child.children()) {
                    if (nested.isCase() || nested.isDefaultCase()) {
                        cases.add(nested);
                    }
                }
            }
        }
        return cases;
    }

    /**
     * Concatenate the case bodies in the given order, or nothing if the result would not behave like the loop.
     * Every statement is terminated and the fragment ends with a line break, so the code around it keeps its meaning.
     */
    private Optional<String> reorder(ScriptSnapshot snapshot, Node dispatch, List<Integer> order) {
        List<Node> cases = casesOf(dispatch);
        Map<Integer, Integer> caseIndices = new LinkedHashMap<>();
        boolean hasDefault = false;

        for (int i = 0; i < cases.size(); i++) {
            Node switchCase = cases.get(i);
            if (switchCase.isDefaultCase()) {
                hasDefault = true;
                continue;
            }
            Optional<Integer> value = AstUtil.integerOf(switchCase.getFirstChild());
            if (value.isPresent()) {
                caseIndices.putIfAbsent(value.get(), i);
            }
        }

        StringBuilder builder = new StringBuilder("/* recovered order: ");
        builder.append(order.stream().map(String::valueOf).collect(Collectors.joining(", "))).append(" */");

        for (int value : order) {
            Integer index = caseIndices.get(value);
            if (index == null) {
                if (hasDefault) {
                    // The default case would run for this value
                    return Optional.empty();
                }
                continue;
            }

            Optional<List<Node>> statements = caseStatements(cases, index);
            if (statements.isEmpty()) {
                return Optional.empty();
            }

            builder.append("\n// case ").append(value);
            for (Node statement : statements.get()) {
                builder.append('\n').append(terminated(statement, snapshot.slice(statement)));
            }
        }

        return Optional.of(builder.append('\n').toString());
    }

    /**
     * Make a statement's text safe to place between arbitrary statements.
     * {@code a()} becomes {@code a();}, {@code (b)()} becomes {@code ;(b)();}.
     */
    private String terminated(Node statement, String text) {
        String result = text;
        if (!result.isEmpty() && "([`+-/".indexOf(result.charAt(0)) >= 0) {
            result = ";" + result;
        }

        String trimmed = result.stripTrailing();
        boolean needsSemicolon = SIMPLE_STATEMENTS.contains(statement.getToken())
                ? !trimmed.endsWith(";")
                : !trimmed.endsWith(";") && !trimmed.endsWith("}");
        return needsSemicolon ? trimmed + ";" : result;
    }

    /**
     * Get the statements of one case without its trailing break, or nothing if the case falls through
     * or jumps out of the switch from a nested position
     */
    private Optional<List<Node>> caseStatements(List<Node> cases, int index) {
        Node switchCase = cases.get(index);
        Node block = switchCase.getLastChild();
        List<Node> statements = new ArrayList<>();
        if (block != null && block.isBlock()) {
            for (Node statement : block.children()) {
                statements.add(statement);
            }
        }

        boolean lastCase = index == cases.size() - 1;
        if (!statements.isEmpty() && isLocalExit(statements.get(statements.size() - 1))) {
            statements.remove(statements.size() - 1);
        } else if (!lastCase && (statements.isEmpty() || !isFunctionExit(statements.get(statements.size() - 1)))) {
            return Optional.empty();
        }

        for (Node statement : statements) {
            if (containsLooseJump(statement)) {
                return Optional.empty();
            }
        }
        return Optional.of(statements);
    }

    /**
     * Unlabeled {@code break} or {@code continue}: ends this iteration of the dispatch
     */
    private boolean isLocalExit(Node statement) {
        return (statement.isBreak() || statement.isContinue()) && !statement.hasChildren();
    }

    private boolean isFunctionExit(Node statement) {
        return statement.isReturn() || statement.isThrow();
    }

    /**
     * Check for a break or continue that would no longer have its target once the loop is gone
     */
    private boolean containsLooseJump(Node statement) {
        boolean[] loose = {false};
        AstUtil.walk(statement, node -> {
            if (loose[0] || node.isFunction()) {
                return false;
            }
            if (node.isBreak() || node.isContinue()) {
                loose[0] = !isCaptured(node, statement);
            }
            return true;
        });
        return loose[0];
    }

    /**
     * Check if an unlabeled jump is caught by a loop or switch nested inside {@code root}
     */
    private boolean isCaptured(Node jump, Node root) {
        if (jump == root || jump.hasChildren()) {
            return false;
        }

        for (Node current = jump.getParent(); current != null; current = current.getParent()) {
            if (AstUtil.isLoop(current) || (jump.isBreak() && current.isSwitch())) {
                return true;
            }
            if (current == root) {
                break;
            }
        }
        return false;
    }

    private static final class RestoreState {
        private final Set<String> reassigned;
        private final Scope scope = new Scope();
        private final List<Replacement> replacements = new ArrayList<>();

        private RestoreState(Set<String> reassigned) {
            this.reassigned = reassigned;
        }
    }
}
