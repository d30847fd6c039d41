package dead.owner.jsunpack.transformers.constant;

import com.google.javascript.rhino.Node;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Binary;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Constant;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.MathCall;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Operator;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Unary;
import dead.owner.jsunpack.transformers.scope.Binding;
import dead.owner.jsunpack.transformers.scope.Scope;
import dead.owner.jsunpack.utils.AstUtil;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rebuilds an AST expression as a {@link ConstantExpression}.
 * Anything that is not a literal, a bound name, an operator or a pure math call makes the whole build fail.
 */
public class ConstantExpressionBuilder {

    static final int MAX_DEPTH = 256;

    private final String mathNamespace;

    public ConstantExpressionBuilder(String mathNamespace) {
        this.mathNamespace = mathNamespace;
    }

    public Optional<ConstantExpression> build(Node node, Scope scope) {
        return build(node, scope, 0);
    }

    private Optional<ConstantExpression> build(Node node, Scope scope, int depth) {
        if (node == null || depth > MAX_DEPTH) {
            return Optional.empty();
        }

        switch (node.getToken()) {
            case NUMBER:
                return Optional.of(new Constant(node.getDouble()));
            case STRINGLIT:
                return Optional.of(new Constant(node.getString()));
            case TRUE:
                return Optional.of(new Constant(Boolean.TRUE));
            case FALSE:
                return Optional.of(new Constant(Boolean.FALSE));
            case NAME:
                return resolveName(node.getString(), scope);
            case GETPROP: {
                String member = AstUtil.memberOf(node, mathNamespace);
                return member == null ? Optional.empty() : MathFunctions.constant(member).map(Constant::new);
            }
            case CALL:
                return buildCall(node, scope, depth);
            default:
                break;
        }

        if (node.hasOneChild()) {
            return buildUnary(node, scope, depth);
        }
        if (node.getChildCount() == 2) {
            return buildBinary(node, scope, depth);
        }
        return Optional.empty();
    }

    /**
     * Resolve an identifier through the scope. Unbound names never resolve.
     */
    private Optional<ConstantExpression> resolveName(String identifier, Scope scope) {
        Optional<Binding> binding = scope.lookup(identifier);
        if (binding.isEmpty()) {
            return Optional.empty();
        }

        Binding bound = binding.get();
        if (bound instanceof Binding.Literal literal) {
            return Optional.of(new Constant(literal.value()));
        }
        if (bound instanceof Binding.MathRef mathRef) {
            // Only constants can be used as values, functions must be called
            return MathFunctions.constant(mathRef.member()).map(Constant::new);
        }
        return Optional.empty();
    }

    private Optional<ConstantExpression> buildUnary(Node unary, Scope scope, int depth) {
        Optional<Operator> operator = Operator.unary(unary.getToken());
        if (operator.isEmpty()) {
            return Optional.empty();
        }
        return build(unary.getFirstChild(), scope, depth + 1)
                .map(operand -> new Unary(operator.get(), operand));
    }

    private Optional<ConstantExpression> buildBinary(Node binary, Scope scope, int depth) {
        Optional<Operator> operator = Operator.binary(binary.getToken());
        if (operator.isEmpty()) {
            return Optional.empty();
        }

        Optional<ConstantExpression> left = build(binary.getFirstChild(), scope, depth + 1);
        if (left.isEmpty()) {
            return Optional.empty();
        }
        return build(binary.getLastChild(), scope, depth + 1)
                .map(right -> new Binary(operator.get(), left.get(), right));
    }

    /**
     * Build a call of a math function, either bound ({@code var a = Math.log; a(1)}) or direct ({@code Math.log(1)})
     */
    private Optional<ConstantExpression> buildCall(Node call, Scope scope, int depth) {
        String function = calledMathFunction(call.getFirstChild(), scope);
        if (function == null || !MathFunctions.isFunction(function)) {
            return Optional.empty();
        }

        List<ConstantExpression> arguments = new ArrayList<>();
        for (Node argument = call.getSecondChild(); argument != null; argument = argument.getNext()) {
            Optional<ConstantExpression> built = build(argument, scope, depth + 1);
            if (built.isEmpty()) {
                return Optional.empty();
            }
            arguments.add(built.get());
        }
        return Optional.of(new MathCall(function, arguments));
    }

    private String calledMathFunction(Node callee, Scope scope) {
        String name = AstUtil.identifierOf(callee);
        if (name != null) {
            return scope.lookup(name, Binding.MathRef.class)
                    .map(Binding.MathRef::member)
                    .orElse(null);
        }
        return AstUtil.memberOf(callee, mathNamespace);
    }
}
