package dead.owner.jsunpack.transformers.constant;

import com.google.javascript.rhino.Token;

import java.util.List;
import java.util.Optional;

/**
 * A side-effect free expression rebuilt from the AST, made only of constants, operators and pure math calls
 */
public sealed interface ConstantExpression
        permits ConstantExpression.Constant, ConstantExpression.Unary,
        ConstantExpression.Binary, ConstantExpression.MathCall {

    /**
     * A number ({@link Double}), string or boolean
     */
    record Constant(Object value) implements ConstantExpression {
    }

    record Unary(Operator operator, ConstantExpression operand) implements ConstantExpression {
    }

    record Binary(Operator operator, ConstantExpression left, ConstantExpression right) implements ConstantExpression {
    }

    /**
     * A call of a whitelisted math function
     */
    record MathCall(String function, List<ConstantExpression> arguments) implements ConstantExpression {
        public MathCall {
            arguments = List.copyOf(arguments);
        }
    }

    enum Operator {
        ADD(Token.ADD), SUB(Token.SUB), MUL(Token.MUL), DIV(Token.DIV), MOD(Token.MOD), EXPONENT(Token.EXPONENT),
        LT(Token.LT), LE(Token.LE), GT(Token.GT), GE(Token.GE),
        EQ(Token.EQ), NE(Token.NE), SHEQ(Token.SHEQ), SHNE(Token.SHNE),
        AND(Token.AND), OR(Token.OR),
        BITAND(Token.BITAND), BITOR(Token.BITOR), BITXOR(Token.BITXOR),
        LSH(Token.LSH), RSH(Token.RSH), URSH(Token.URSH),

        NOT(Token.NOT), NEG(Token.NEG), POS(Token.POS), BITNOT(Token.BITNOT), TYPEOF(Token.TYPEOF);

        private final Token token;

        Operator(Token token) {
            this.token = token;
        }

        public boolean isUnary() {
            return ordinal() >= NOT.ordinal();
        }

        public static Optional<Operator> binary(Token token) {
            return find(token, false);
        }

        public static Optional<Operator> unary(Token token) {
            return find(token, true);
        }

        private static Optional<Operator> find(Token token, boolean unary) {
            for (Operator operator : values()) {
                if (operator.token == token && operator.isUnary() == unary) {
                    return Optional.of(operator);
                }
            }
            return Optional.empty();
        }
    }
}
