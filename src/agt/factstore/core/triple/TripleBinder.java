package factstore.core.triple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Applies bindings to patterns, turning them back into concrete facts.
 */
public final class TripleBinder {

    private TripleBinder() {}

    /**
     * Replace every bound variable of a pattern with its value.
     * Unbound variables and literal slots are kept as they are. Bound values are
     * taken as already normalized and are not validated again.
     *
     * @param pattern Pattern to fill in
     * @param bindings Values to substitute
     * @return The original instance if nothing changed, a new triple otherwise
     */
    public static Triple substitute(Triple pattern, Bindings bindings) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        if (!pattern.isPattern() || bindings.isEmpty()) {
            return pattern;
        }

        String id = resolve(pattern.id, bindings);
        String predicate = resolve(pattern.predicate, bindings);
        String object = resolve(pattern.object, bindings);

        boolean changed = !id.equalsIgnoreCase(pattern.id)
            || !predicate.equalsIgnoreCase(pattern.predicate)
            || !object.equalsIgnoreCase(pattern.object);

        return changed ? Triple.trusted(id, predicate, object) : pattern;
    }

    /**
     * Substitute the same bindings into each pattern of a conjunction.
     */
    public static List<Triple> substituteAll(List<Triple> patterns, Bindings bindings) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        List<Triple> result = new ArrayList<>(patterns.size());
        for (Triple pattern : patterns) {
            result.add(substitute(pattern, bindings));
        }
        return Collections.unmodifiableList(result);
    }

    private static String resolve(String term, Bindings bindings) {
        if (!Primitives.isVariable(term)) {
            return term;
        }
        String value = bindings.get(term);
        return value != null ? value : term;
    }
}
