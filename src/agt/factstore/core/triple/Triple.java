package factstore.core.triple;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * A subject-predicate-object triple. Acts as a concrete fact when no slot is a
 * variable, and as a query pattern otherwise.
 * All slots are normalized on construction; instances are immutable.
 */
public final class Triple {

    public final String id;
    public final String predicate;
    public final String object;

    private final boolean pattern;

    /**
     * Create a triple from raw tokens.
     *
     * @param id Subject token
     * @param predicate Predicate token
     * @param object Object token
     * @throws TripleFormatException if any token fails normalization
     */
    public Triple(String id, String predicate, String object) {
        Objects.requireNonNull(id, "Id cannot be null");
        Objects.requireNonNull(predicate, "Predicate cannot be null");
        Objects.requireNonNull(object, "Object cannot be null");

        this.id = Primitives.normalize(id);
        this.predicate = Primitives.normalize(predicate);
        this.object = Primitives.normalize(object);
        this.pattern = isPattern(this.id, this.predicate, this.object);
    }

    private Triple(String id, String predicate, String object, boolean pattern) {
        this.id = id;
        this.predicate = predicate;
        this.object = object;
        this.pattern = pattern;
    }

    /**
     * Build from slots that are already normalized primitives or bound values, skipping validation.
     */
    static Triple trusted(String id, String predicate, String object) {
        String lowerId = id.toLowerCase(Locale.ROOT);
        String lowerPredicate = predicate.toLowerCase(Locale.ROOT);
        String lowerObject = object.toLowerCase(Locale.ROOT);
        return new Triple(lowerId, lowerPredicate, lowerObject,
            isPattern(lowerId, lowerPredicate, lowerObject));
    }

    private static boolean isPattern(String id, String predicate, String object) {
        return Primitives.isVariable(id)
            || Primitives.isVariable(predicate)
            || Primitives.isVariable(object);
    }

    /**
     * @return True if at least one slot is a variable
     */
    public boolean isPattern() {
        return pattern;
    }

    /**
     * @return True if the slots are three distinct variables, i.e. the pattern matches any fact
     */
    public boolean isWildcard() {
        return variables().size() == 3;
    }

    /**
     * Variables used by this triple, in slot order and without duplicates.
     */
    public Set<String> variables() {
        if (!pattern) {
            return Collections.emptySet();
        }
        Set<String> variables = new LinkedHashSet<>(3);
        for (String slot : new String[] {id, predicate, object}) {
            if (Primitives.isVariable(slot)) {
                variables.add(slot);
            }
        }
        return Collections.unmodifiableSet(variables);
    }

    /**
     * Substitute bound variables of this triple.
     *
     * @see TripleBinder#substitute(Triple, Bindings)
     */
    public Triple applyBindings(Bindings bindings) {
        return TripleBinder.substitute(this, bindings);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Triple)) return false;
        Triple other = (Triple) obj;
        // slots are lowercased on construction
        return id.equals(other.id)
            && predicate.equals(other.predicate)
            && object.equals(other.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, predicate, object);
    }

    @Override
    public String toString() {
        return String.format("Triple = <%s, %s, %s>", id, predicate, object);
    }
}
