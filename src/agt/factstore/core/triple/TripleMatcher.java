package factstore.core.triple;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Matches a pattern against a concrete fact and derives the bindings implied by
 * the pattern's variables.
 * A failed match is an ordinary outcome ({@code false} or empty), never an exception,
 * so callers can test many candidate facts cheaply.
 */
public final class TripleMatcher {

    private TripleMatcher() {}

    /**
     * Check whether a pattern matches a fact, using a fresh scratch table.
     */
    public static boolean matches(Triple pattern, Triple fact) {
        return matches(pattern, fact, new MatchScratch());
    }

    /**
     * Check whether a pattern matches a fact.
     * Slots are compared in id, predicate, object order and the check stops at
     * the first mismatch. A variable used twice must see the same value both times.
     *
     * @param pattern Pattern (or concrete triple) to test
     * @param fact Candidate fact
     * @param scratch Workspace to reuse; cleared before use
     * @return True if every slot matches
     */
    public static boolean matches(Triple pattern, Triple fact, MatchScratch scratch) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        Objects.requireNonNull(fact, "Fact cannot be null");
        Objects.requireNonNull(scratch, "Scratch cannot be null");

        scratch.clear();
        return matchesSlot(pattern.id, fact.id, scratch)
            && matchesSlot(pattern.predicate, fact.predicate, scratch)
            && matchesSlot(pattern.object, fact.object, scratch);
    }

    /**
     * Match a pattern against a fact and extend existing bindings with the
     * values its variables took.
     *
     * @param pattern Pattern to match
     * @param fact Candidate fact
     * @param existing Bindings fixed so far; never overridden
     * @return Existing bindings layered under the new ones, or empty if no match
     */
    public static Optional<Bindings> deriveBindings(Triple pattern, Triple fact, Bindings existing) {
        return deriveBindings(pattern, fact, existing, new MatchScratch());
    }

    public static Optional<Bindings> deriveBindings(Triple pattern, Triple fact, Bindings existing,
                                                    MatchScratch scratch) {
        Objects.requireNonNull(existing, "Existing bindings cannot be null");
        if (!matches(pattern, fact, scratch)) {
            return Optional.empty();
        }

        List<Bindings.Binding> additions = new ArrayList<>(3);
        addIfUnbound(pattern.id, fact.id, existing, additions);
        addIfUnbound(pattern.predicate, fact.predicate, existing, additions);
        addIfUnbound(pattern.object, fact.object, existing, additions);

        return Optional.of(Bindings.layered(existing, additions));
    }

    /**
     * Re-derive the bindings of a conjunction from the facts each pattern matched.
     * Patterns are taken in order; bindings from earlier patterns are applied to
     * later ones before matching, so a later fact that disagrees with an earlier
     * binding ends the derivation.
     *
     * @param patterns Conjunction, in precedence order
     * @param facts Fact matched by the pattern at the same position
     * @param existing Bindings to start from
     * @return The accumulated bindings, or empty as soon as one pair fails
     */
    public static Optional<Bindings> deriveBindings(List<Triple> patterns, List<Triple> facts,
                                                    Bindings existing) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        Objects.requireNonNull(facts, "Facts cannot be null");
        if (patterns.size() != facts.size()) {
            throw new IllegalArgumentException(
                "Expected one fact per pattern, got " + facts.size() + " for " + patterns.size());
        }

        MatchScratch scratch = new MatchScratch();
        Bindings accumulated = Objects.requireNonNull(existing, "Existing bindings cannot be null");
        for (int i = 0; i < patterns.size(); i++) {
            Triple pattern = TripleBinder.substitute(patterns.get(i), accumulated);
            Optional<Bindings> next = deriveBindings(pattern, facts.get(i), accumulated, scratch);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            accumulated = next.get();
        }
        return Optional.of(accumulated);
    }

    private static boolean matchesSlot(String patternTerm, String factTerm, MatchScratch scratch) {
        if (Primitives.isVariable(patternTerm)) {
            String bound = scratch.valueOf(patternTerm);
            if (bound != null && !bound.equals(factTerm)) {
                return false; // must match the earlier occurrence
            }
            scratch.record(patternTerm, factTerm);
            return true;
        }
        return patternTerm.equals(factTerm);
    }

    private static void addIfUnbound(String patternTerm, String factTerm, Bindings existing,
                                     List<Bindings.Binding> additions) {
        if (Primitives.isVariable(patternTerm) && !existing.contains(patternTerm)) {
            additions.add(new Bindings.Binding(patternTerm, factTerm));
        }
    }
}
