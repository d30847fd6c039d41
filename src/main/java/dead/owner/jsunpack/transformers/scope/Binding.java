package dead.owner.jsunpack.transformers.scope;

import java.util.ArrayList;
import java.util.List;

/**
 * A statically known value associated with an identifier during one traversal
 */
public sealed interface Binding
        permits Binding.Literal, Binding.MathRef, Binding.ArrayBinding, Binding.SwapFunctionMarker {

    /**
     * A literal number, string or boolean
     */
    record Literal(Object value) implements Binding {
        public Literal {
            if (!(value instanceof Double || value instanceof String || value instanceof Boolean)) {
                throw new IllegalArgumentException("Unsupported literal value: " + value);
            }
        }
    }

    /**
     * A reference to a member of the math namespace, e.g. {@code Math.log}
     */
    record MathRef(String namespace, String member) implements Binding {
    }

    /**
     * The modeled contents of an integer array
     */
    record ArrayBinding(List<Integer> sequence) implements Binding {
        public ArrayBinding {
            sequence = List.copyOf(sequence);
        }

        public boolean inBounds(int index) {
            return index >= 0 && index < sequence.size();
        }

        /**
         * Model {@code array[first] <-> array[second]}
         */
        public ArrayBinding swap(int first, int second) {
            List<Integer> swapped = new ArrayList<>(sequence);
            Integer value = swapped.get(first);
            swapped.set(first, swapped.get(second));
            swapped.set(second, value);
            return new ArrayBinding(swapped);
        }
    }

    /**
     * A function recognized as exchanging two elements of its first argument
     */
    record SwapFunctionMarker(String functionName) implements Binding {
    }
}
