package dead.owner.jsunpack.transformers;

import com.google.javascript.rhino.Node;
import dead.owner.jsunpack.Run;
import dead.owner.jsunpack.UnpackSettings;
import dead.owner.jsunpack.transformers.constant.ConstantEvaluator;
import dead.owner.jsunpack.transformers.constant.ConstantExpressionBuilder;
import dead.owner.jsunpack.transformers.scope.Binding;
import dead.owner.jsunpack.transformers.scope.Scope;
import dead.owner.jsunpack.utils.AstUtil;
import dead.owner.jsunpack.utils.rewrite.Replacement;
import dead.owner.jsunpack.utils.wrapper.ScriptSnapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Transformer to replace statically decidable branch tests with {@code true} or {@code false}.
 * <p>
 * Declarations are tracked in one flat scope, in document order:
 * <pre>
 *     var a = Math.log;            // a -> Math.log
 *     var limit = 3;               // limit -> 3
 *     if (a(100) > a(1)) { ... }   // if (true) { ... }
 *     if (x > limit) { ... }       // x is unbound, left untouched
 * </pre>
 */
public class ConstantConditionFolder implements Transformer {

    private final String mathNamespace;
    private final ConstantExpressionBuilder builder;
    private final ConstantEvaluator evaluator = new ConstantEvaluator();

    public ConstantConditionFolder() {
        this(UnpackSettings.defaults());
    }

    public ConstantConditionFolder(UnpackSettings settings) {
        this.mathNamespace = settings.mathNamespace();
        this.builder = new ConstantExpressionBuilder(mathNamespace);
    }

    @Override
    public List<Replacement> transform(ScriptSnapshot snapshot) {
        FoldState state = new FoldState(AstUtil.reassignedNames(snapshot.getBody()));

        snapshot.visit(node -> {
            if (state.folded.contains(node)) {
                // Already replaced as a whole
                return false;
            }
            if (AstUtil.isDeclaredName(node)) {
                bindDeclaration(node, state);
                return true;
            }

            Node test = testOf(node);
            if (test != null) {
                builder.build(test, state.scope)
                        .flatMap(evaluator::decide)
                        .ifPresent(value -> {
                            state.folded.add(test);
                            state.replacements.add(snapshot.replace(test, String.valueOf(value)));
                        });
            }
            return true;
        });

        if (!state.replacements.isEmpty()) {
            Run.log(getClass().getSimpleName() + " | Folded " + state.replacements.size() + " constant conditions");
        }
        return state.replacements;
    }

    /**
     * Get the test of a branch, or null if the node does not branch
     */
    private Node testOf(Node node) {
        if (node.isIf() || node.isHook()) {
            return node.getFirstChild();
        }
        return null;
    }

    /**
     * Record what a declaration binds its name to. Unrecognized initializers drop any earlier binding.
     */
    private void bindDeclaration(Node declared, FoldState state) {
        String name = AstUtil.identifierOf(declared);
        if (name == null) {
            return;
        }
        if (state.reassigned.contains(name)) {
            state.scope.unbind(name);
            return;
        }

        Optional<Binding> binding = bindingOf(declared.getFirstChild());
        if (binding.isPresent()) {
            state.scope.bind(name, binding.get());
        } else {
            state.scope.unbind(name);
        }
    }

    private Optional<Binding> bindingOf(Node initializer) {
        if (initializer == null) {
            return Optional.empty();
        }

        String member = AstUtil.memberOf(initializer, mathNamespace);
        if (member != null) {
            return Optional.of(new Binding.MathRef(mathNamespace, member));
        }

        Optional<Double> number = AstUtil.numberOf(initializer);
        if (number.isPresent()) {
            return Optional.of(new Binding.Literal(number.get()));
        }
        if (initializer.isString()) {
            return Optional.of(new Binding.Literal(initializer.getString()));
        }
        if (initializer.isTrue() || initializer.isFalse()) {
            return Optional.of(new Binding.Literal(initializer.isTrue()));
        }
        return Optional.empty();
    }

    private static final class FoldState {
        private final Set<String> reassigned;
        private final Scope scope = new Scope();
        private final List<Replacement> replacements = new ArrayList<>();
        private final Set<Node> folded = Collections.newSetFromMap(new IdentityHashMap<>());

        private FoldState(Set<String> reassigned) {
            this.reassigned = reassigned;
        }
    }
}
