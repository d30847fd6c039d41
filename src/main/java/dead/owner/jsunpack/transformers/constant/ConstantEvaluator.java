package dead.owner.jsunpack.transformers.constant;

import dead.owner.jsunpack.transformers.constant.ConstantExpression.Binary;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Constant;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.MathCall;
import dead.owner.jsunpack.transformers.constant.ConstantExpression.Unary;

import java.util.Optional;

import static dead.owner.jsunpack.transformers.constant.JsValues.toBoolean;
import static dead.owner.jsunpack.transformers.constant.JsValues.toInt32;
import static dead.owner.jsunpack.transformers.constant.JsValues.toNumber;
import static dead.owner.jsunpack.transformers.constant.JsValues.toUint32;

/**
 * Evaluates {@link ConstantExpression} trees with JavaScript semantics.
 * The only reachable operations are primitive arithmetic and the {@link MathFunctions} whitelist.
 */
public class ConstantEvaluator {

    /**
     * Decide a branch test: booleans as-is, numbers are true iff greater than zero
     *
     * @return the truth value, or nothing if the result is of any other type or evaluation failed
     */
    public Optional<Boolean> decide(ConstantExpression expression) {
        Optional<Object> result = evaluate(expression);
        if (result.isEmpty()) {
            return Optional.empty();
        }

        Object value = result.get();
        if (value instanceof Boolean bool) {
            return Optional.of(bool);
        }
        if (value instanceof Double number) {
            return Optional.of(number > 0);
        }
        return Optional.empty();
    }

    public Optional<Object> evaluate(ConstantExpression expression) {
        if (expression instanceof Constant constant) {
            return Optional.of(constant.value());
        }
        if (expression instanceof Unary unary) {
            return evaluate(unary.operand()).flatMap(operand -> applyUnary(unary, operand));
        }
        if (expression instanceof Binary binary) {
            return evaluateBinary(binary);
        }
        if (expression instanceof MathCall call) {
            return evaluateCall(call);
        }
        return Optional.empty();
    }

    private Optional<Object> applyUnary(Unary unary, Object operand) {
        switch (unary.operator()) {
            case NOT:
                return Optional.of(!toBoolean(operand));
            case NEG:
                return Optional.of(-toNumber(operand));
            case POS:
                return Optional.of(toNumber(operand));
            case BITNOT:
                return Optional.of((double) ~toInt32(toNumber(operand)));
            case TYPEOF:
                return Optional.of(JsValues.typeOf(operand));
            default:
                return Optional.empty();
        }
    }

    private Optional<Object> evaluateBinary(Binary binary) {
        Optional<Object> left = evaluate(binary.left());
        if (left.isEmpty()) {
            return Optional.empty();
        }

        // Short-circuit operators yield one of their operands
        switch (binary.operator()) {
            case AND:
                return toBoolean(left.get()) ? evaluate(binary.right()) : left;
            case OR:
                return toBoolean(left.get()) ? left : evaluate(binary.right());
            default:
                break;
        }

        return evaluate(binary.right()).flatMap(right -> applyBinary(binary, left.get(), right));
    }

    private Optional<Object> applyBinary(Binary binary, Object left, Object right) {
        switch (binary.operator()) {
            case ADD:
                if (left instanceof String || right instanceof String) {
                    return Optional.of(JsValues.toJsString(left) + JsValues.toJsString(right));
                }
                return Optional.of(toNumber(left) + toNumber(right));
            case SUB:
                return Optional.of(toNumber(left) - toNumber(right));
            case MUL:
                return Optional.of(toNumber(left) * toNumber(right));
            case DIV:
                return Optional.of(toNumber(left) / toNumber(right));
            case MOD:
                return Optional.of(toNumber(left) % toNumber(right));
            case EXPONENT:
                return Optional.of(Math.pow(toNumber(left), toNumber(right)));
            case LT:
                return Optional.of(compare(left, right).map(order -> order < 0).orElse(false));
            case LE:
                return Optional.of(compare(left, right).map(order -> order <= 0).orElse(false));
            case GT:
                return Optional.of(compare(left, right).map(order -> order > 0).orElse(false));
            case GE:
                return Optional.of(compare(left, right).map(order -> order >= 0).orElse(false));
            case EQ:
                return Optional.of(JsValues.looseEquals(left, right));
            case NE:
                return Optional.of(!JsValues.looseEquals(left, right));
            case SHEQ:
                return Optional.of(JsValues.strictEquals(left, right));
            case SHNE:
                return Optional.of(!JsValues.strictEquals(left, right));
            case BITAND:
                return Optional.of((double) (toInt32(toNumber(left)) & toInt32(toNumber(right))));
            case BITOR:
                return Optional.of((double) (toInt32(toNumber(left)) | toInt32(toNumber(right))));
            case BITXOR:
                return Optional.of((double) (toInt32(toNumber(left)) ^ toInt32(toNumber(right))));
            case LSH:
                return Optional.of((double) (toInt32(toNumber(left)) << shiftCount(right)));
            case RSH:
                return Optional.of((double) (toInt32(toNumber(left)) >> shiftCount(right)));
            case URSH:
                return Optional.of((double) (toUint32(toNumber(left)) >>> shiftCount(right)));
            default:
                return Optional.empty();
        }
    }

    /**
     * Compare two primitives, strings by code unit, everything else numerically.
     * Nothing if either side is NaN, every relational operator is then false.
     */
    private Optional<Integer> compare(Object left, Object right) {
        if (left instanceof String leftString && right instanceof String rightString) {
            return Optional.of(Integer.signum(leftString.compareTo(rightString)));
        }
        double l = toNumber(left);
        double r = toNumber(right);
        if (Double.isNaN(l) || Double.isNaN(r)) {
            return Optional.empty();
        }
        return Optional.of(l < r ? -1 : l > r ? 1 : 0);
    }

    private int shiftCount(Object value) {
        return (int) (toUint32(toNumber(value)) & 0x1F);
    }

    private Optional<Object> evaluateCall(MathCall call) {
        double[] arguments = new double[call.arguments().size()];
        for (int i = 0; i < arguments.length; i++) {
            Optional<Object> argument = evaluate(call.arguments().get(i));
            if (argument.isEmpty()) {
                return Optional.empty();
            }
            arguments[i] = toNumber(argument.get());
        }
        return MathFunctions.apply(call.function(), arguments).map(Object.class::cast);
    }
}
