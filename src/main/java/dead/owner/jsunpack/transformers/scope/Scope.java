package dead.owner.jsunpack.transformers.scope;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Flat identifier-to-binding map, owned by a single traversal and updated in document order
 */
public final class Scope {
    private final Map<String, Binding> bindings = new HashMap<>();

    public Optional<Binding> lookup(String name) {
        return Optional.ofNullable(bindings.get(name));
    }

    /**
     * Look up a binding of a given kind
     */
    public <T extends Binding> Optional<T> lookup(String name, Class<T> kind) {
        return lookup(name).filter(kind::isInstance).map(kind::cast);
    }

    /**
     * Bind a name, replacing any earlier binding
     */
    public void bind(String name, Binding binding) {
        bindings.put(name, binding);
    }

    public void unbind(String name) {
        bindings.remove(name);
    }

    public boolean isBound(String name) {
        return bindings.containsKey(name);
    }

    public int size() {
        return bindings.size();
    }
}
