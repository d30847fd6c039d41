package dead.owner.jsunpack.transformers.constant;

import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * The pure members of the JavaScript {@code Math} namespace.
 * {@code Math.random} is not included, so calls to it never fold.
 */
public final class MathFunctions {

    private static final Map<String, Double> CONSTANTS = Map.of(
            "E", Math.E,
            "LN2", Math.log(2),
            "LN10", Math.log(10),
            "LOG2E", 1 / Math.log(2),
            "LOG10E", 1 / Math.log(10),
            "PI", Math.PI,
            "SQRT1_2", Math.sqrt(0.5),
            "SQRT2", Math.sqrt(2)
    );

    private static final Map<String, Function<double[], Double>> FUNCTIONS = Map.ofEntries(
            Map.entry("abs", args -> Math.abs(arg(args, 0))),
            Map.entry("acos", args -> Math.acos(arg(args, 0))),
            Map.entry("asin", args -> Math.asin(arg(args, 0))),
            Map.entry("atan", args -> Math.atan(arg(args, 0))),
            Map.entry("atan2", args -> Math.atan2(arg(args, 0), arg(args, 1))),
            Map.entry("cbrt", args -> Math.cbrt(arg(args, 0))),
            Map.entry("ceil", args -> Math.ceil(arg(args, 0))),
            Map.entry("cos", args -> Math.cos(arg(args, 0))),
            Map.entry("exp", args -> Math.exp(arg(args, 0))),
            Map.entry("floor", args -> Math.floor(arg(args, 0))),
            Map.entry("hypot", MathFunctions::hypot),
            Map.entry("log", args -> Math.log(arg(args, 0))),
            Map.entry("log10", args -> Math.log10(arg(args, 0))),
            Map.entry("log2", args -> log2(arg(args, 0))),
            Map.entry("max", MathFunctions::max),
            Map.entry("min", MathFunctions::min),
            Map.entry("pow", args -> Math.pow(arg(args, 0), arg(args, 1))),
            Map.entry("round", args -> round(arg(args, 0))),
            Map.entry("sign", args -> Math.signum(arg(args, 0))),
            Map.entry("sin", args -> Math.sin(arg(args, 0))),
            Map.entry("sqrt", args -> Math.sqrt(arg(args, 0))),
            Map.entry("tan", args -> Math.tan(arg(args, 0))),
            Map.entry("trunc", args -> trunc(arg(args, 0)))
    );

    private MathFunctions() {
    }

    public static Optional<Double> constant(String name) {
        return Optional.ofNullable(CONSTANTS.get(name));
    }

    public static boolean isFunction(String name) {
        return FUNCTIONS.containsKey(name);
    }

    /**
     * Apply a whitelisted function, or nothing if the name is unknown
     */
    public static Optional<Double> apply(String name, double[] arguments) {
        Function<double[], Double> function = FUNCTIONS.get(name);
        return function == null ? Optional.empty() : Optional.of(function.apply(arguments));
    }

    // Missing arguments are undefined, which converts to NaN
    private static double arg(double[] args, int index) {
        return index < args.length ? args[index] : Double.NaN;
    }

    private static double max(double[] args) {
        double result = Double.NEGATIVE_INFINITY;
        for (double value : args) {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            result = Math.max(result, value);
        }
        return result;
    }

    private static double min(double[] args) {
        double result = Double.POSITIVE_INFINITY;
        for (double value : args) {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            result = Math.min(result, value);
        }
        return result;
    }

    private static double hypot(double[] args) {
        double sum = 0;
        for (double value : args) {
            if (Double.isInfinite(value)) {
                return Double.POSITIVE_INFINITY;
            }
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    // Ties round up. value + 0.5 would round 0.49999999999999994 to 1.
    private static double round(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        double floor = Math.floor(value);
        double rounded = value - floor >= 0.5 ? floor + 1 : floor;
        return rounded == 0 && value < 0 ? -0.0 : rounded;
    }

    private static double trunc(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static double log2(double value) {
        double result = Math.log(value) / Math.log(2);
        double rounded = Math.rint(result);
        // Exact for powers of two
        return Math.pow(2, rounded) == value ? rounded : result;
    }
}
