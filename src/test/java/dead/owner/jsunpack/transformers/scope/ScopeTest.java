package dead.owner.jsunpack.transformers.scope;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ScopeTest {

    @Test
    void testBindIsVisibleToLaterLookups() {
        Scope scope = new Scope();
        assertThat(scope.lookup("limit")).isEmpty();

        scope.bind("limit", new Binding.Literal(3.0));

        assertThat(scope.lookup("limit")).contains(new Binding.Literal(3.0));
        assertThat(scope.isBound("limit")).isTrue();
        assertThat(scope.size()).isEqualTo(1);
    }

    @Test
    void testLaterBindingShadowsEarlierOne() {
        Scope scope = new Scope();
        scope.bind("a", new Binding.Literal(1.0));
        scope.bind("a", new Binding.MathRef("Math", "log"));

        assertThat(scope.size()).isEqualTo(1);
        assertThat(scope.lookup("a", Binding.MathRef.class)).contains(new Binding.MathRef("Math", "log"));
        assertThat(scope.lookup("a", Binding.Literal.class)).isEmpty();
    }

    @Test
    void testUnbindRemovesOnlyThatName() {
        Scope scope = new Scope();
        scope.bind("a", new Binding.Literal(1.0));
        scope.bind("b", new Binding.Literal("x"));

        scope.unbind("a");
        scope.unbind("missing");

        assertThat(scope.lookup("a")).isEmpty();
        assertThat(scope.lookup("b")).isPresent();
        assertThat(scope.size()).isEqualTo(1);
    }

    @Test
    void testManyBindingsInOneTraversal() {
        Scope scope = new Scope();
        for (int i = 0; i < 100_000; i++) {
            scope.bind("v" + i, new Binding.Literal((double) i));
        }

        assertThat(scope.size()).isEqualTo(100_000);
        assertThat(scope.lookup("v99999", Binding.Literal.class)).contains(new Binding.Literal(99999.0));
    }

    @Test
    void testArraySwapProducesNewSequence() {
        Binding.ArrayBinding array = new Binding.ArrayBinding(List.of(2, 0, 1, 3));

        Binding.ArrayBinding swapped = array.swap(0, 3);

        assertThat(swapped.sequence()).containsExactly(3, 0, 1, 2);
        assertThat(array.sequence()).containsExactly(2, 0, 1, 3);
        assertThat(array.inBounds(3)).isTrue();
        assertThat(array.inBounds(4)).isFalse();
        assertThat(array.inBounds(-1)).isFalse();
    }

    @Test
    void testLiteralRejectsNonPrimitiveValues() {
        assertThatThrownBy(() -> new Binding.Literal(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
