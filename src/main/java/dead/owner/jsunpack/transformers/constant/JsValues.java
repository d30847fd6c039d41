package dead.owner.jsunpack.transformers.constant;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.regex.Pattern;

/**
 * JavaScript conversion rules for the primitive values the evaluator handles:
 * {@link Double}, {@link String} and {@link Boolean}.
 */
public final class JsValues {
    private static final Pattern WHITESPACE_EDGES =
            Pattern.compile("^[\\s\\u00A0\\uFEFF\\u2028\\u2029]+|[\\s\\u00A0\\uFEFF\\u2028\\u2029]+$");
    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern RADIX = Pattern.compile("0([xXoObB])([0-9a-fA-F]+)");

    private JsValues() {
    }

    public static double toNumber(Object value) {
        if (value instanceof Double number) {
            return number;
        }
        if (value instanceof Boolean bool) {
            return bool ? 1 : 0;
        }
        return stringToNumber((String) value);
    }

    public static boolean toBoolean(Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Double number) {
            return number != 0 && !number.isNaN();
        }
        return !((String) value).isEmpty();
    }

    public static String toJsString(Object value) {
        if (value instanceof Double number) {
            return numberToString(number);
        }
        return String.valueOf(value);
    }

    public static int toInt32(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return 0;
        }
        return (int) (long) (value % 4294967296.0);
    }

    public static long toUint32(double value) {
        return toInt32(value) & 0xFFFFFFFFL;
    }

    public static String typeOf(Object value) {
        if (value instanceof Double) {
            return "number";
        }
        return value instanceof Boolean ? "boolean" : "string";
    }

    /**
     * {@code ==} between two primitives
     */
    public static boolean looseEquals(Object left, Object right) {
        if (left.getClass() == right.getClass()) {
            return strictEquals(left, right);
        }
        if (left instanceof Boolean) {
            return looseEquals(toNumber(left), right);
        }
        if (right instanceof Boolean) {
            return looseEquals(left, toNumber(right));
        }
        // One number and one string left
        return toNumber(left) == toNumber(right);
    }

    /**
     * {@code ===} between two primitives
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left instanceof Double l && right instanceof Double r) {
            return l.doubleValue() == r.doubleValue();
        }
        return left.equals(right);
    }

    static double stringToNumber(String value) {
        String trimmed = WHITESPACE_EDGES.matcher(value).replaceAll("");
        if (trimmed.isEmpty()) {
            return 0;
        }

        switch (trimmed) {
            case "Infinity":
            case "+Infinity":
                return Double.POSITIVE_INFINITY;
            case "-Infinity":
                return Double.NEGATIVE_INFINITY;
            default:
                break;
        }

        var radix = RADIX.matcher(trimmed);
        if (radix.matches()) {
            char prefix = Character.toLowerCase(radix.group(1).charAt(0));
            int base = prefix == 'x' ? 16 : prefix == 'o' ? 8 : 2;
            try {
                return new BigInteger(radix.group(2), base).doubleValue();
            } catch (NumberFormatException e) {
                return Double.NaN;
            }
        }

        return DECIMAL.matcher(trimmed).matches() ? Double.parseDouble(trimmed) : Double.NaN;
    }

    static String numberToString(double value) {
        if (Double.isNaN(value)) {
            return "NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == 0) {
            return "0";
        }

        double magnitude = Math.abs(value);
        if (magnitude >= 1e-6 && magnitude < 1e21) {
            if (value == Math.rint(value)) {
                return new BigDecimal(value).toPlainString();
            }
            return new BigDecimal(Double.toString(value)).stripTrailingZeros().toPlainString();
        }

        // 1.5E-7 -> 1.5e-7, 1.0E21 -> 1e+21
        String javaForm = Double.toString(value);
        int exponentAt = javaForm.indexOf('E');
        String mantissa = javaForm.substring(0, exponentAt);
        String exponent = javaForm.substring(exponentAt + 1);
        if (mantissa.endsWith(".0")) {
            mantissa = mantissa.substring(0, mantissa.length() - 2);
        }
        return mantissa + "e" + (exponent.startsWith("-") ? exponent : "+" + exponent);
    }
}
