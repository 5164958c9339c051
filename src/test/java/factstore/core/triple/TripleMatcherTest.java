package factstore.core.triple;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TripleMatcherTest {

    private static final Triple ALICE_LIKES_CAKE = new Triple("alice", "likes", "cake");

    @Test
    void literalSlotsCompareIgnoringCase() {
        assertThat(TripleMatcher.matches(new Triple("ALICE", "Likes", "cake"), ALICE_LIKES_CAKE)).isTrue();
        assertThat(TripleMatcher.matches(new Triple("bob", "likes", "cake"), ALICE_LIKES_CAKE)).isFalse();
    }

    @Test
    void matchingAgreesWithTripleEquality() {
        Triple longS = new Triple("\u017Fam", "likes", "cake");
        Triple plainS = new Triple("sam", "likes", "cake");

        assertThat(TripleMatcher.matches(longS, plainS)).isFalse();
        assertThat(TripleMatcher.matches(new Triple("?x", "likes", "?x"), new Triple("\u017F", "likes", "s"))).isFalse();
    }

    @Test
    void variableSlotsMatchAnyValue() {
        assertThat(TripleMatcher.matches(new Triple("?who", "likes", "?what"), ALICE_LIKES_CAKE)).isTrue();
        assertThat(TripleMatcher.matches(new Triple("?who", "hates", "?what"), ALICE_LIKES_CAKE)).isFalse();
    }

    @Test
    void repeatedVariableRequiresEqualValues() {
        Triple pattern = new Triple("?a", "?p", "?a");

        assertThat(TripleMatcher.matches(pattern, new Triple("bob", "likes", "bob"))).isTrue();
        assertThat(TripleMatcher.matches(pattern, new Triple("bob", "anything", "BOB"))).isTrue();
        assertThat(TripleMatcher.matches(pattern, new Triple("bob", "likes", "alice"))).isFalse();
    }

    @Test
    void suppliedScratchIsClearedOnEntry() {
        Triple pattern = new Triple("?a", "?p", "?a");
        MatchScratch scratch = new MatchScratch();

        assertThat(TripleMatcher.matches(pattern, new Triple("bob", "likes", "bob"), scratch)).isTrue();
        assertThat(scratch.size()).isEqualTo(2);

        // ?a was bob in the previous attempt, which must not leak into this one
        assertThat(TripleMatcher.matches(pattern, new Triple("carl", "likes", "carl"), scratch)).isTrue();
    }

    @Test
    void deriveBindingsBindsEveryVariable() {
        Optional<Bindings> bindings = TripleMatcher.deriveBindings(
            new Triple("?who", "likes", "?what"), ALICE_LIKES_CAKE, Bindings.empty());

        assertThat(bindings).isPresent();
        assertThat(bindings.get().asMap()).containsExactly(
            Map.entry("?who", "alice"), Map.entry("?what", "cake"));
    }

    @Test
    void deriveBindingsNeverOverridesExisting() {
        Bindings existing = Bindings.of(Map.of("a", "x"));
        Optional<Bindings> bindings = TripleMatcher.deriveBindings(
            new Triple("?a", "likes", "?b"), new Triple("y", "likes", "cake"), existing);

        assertThat(bindings).isPresent();
        assertThat(bindings.get().get("a")).isEqualTo("x");
        assertThat(bindings.get().get("b")).isEqualTo("cake");
        assertThat(existing.size()).isEqualTo(1);
    }

    @Test
    void deriveBindingsIsEmptyWithoutMatch() {
        assertThat(TripleMatcher.deriveBindings(
            new Triple("?a", "hates", "?b"), ALICE_LIKES_CAKE, Bindings.empty())).isEmpty();
    }

    @Test
    void concretePatternDerivesExistingBindings() {
        Bindings existing = Bindings.of(Map.of("a", "x"));
        assertThat(TripleMatcher.deriveBindings(ALICE_LIKES_CAKE, ALICE_LIKES_CAKE, existing))
            .containsSame(existing);
    }

    @Test
    void substitutingDerivedBindingsGivesBackTheFact() {
        List<Triple> patterns = List.of(
            new Triple("?a", "likes", "?b"),
            new Triple("?a", "?p", "?a"),
            new Triple("?s", "?p", "?o"),
            new Triple("alice", "likes", "cake"),
            new Triple("?x", "likes", "cake"));
        List<Triple> facts = List.of(
            ALICE_LIKES_CAKE,
            new Triple("bob", "knows", "bob"),
            new Triple("'ice cream'", "is", "cold"));

        MatchScratch scratch = new MatchScratch();
        int matched = 0;
        for (Triple pattern : patterns) {
            for (Triple fact : facts) {
                if (TripleMatcher.matches(pattern, fact, scratch)) {
                    Bindings bindings = TripleMatcher.deriveBindings(pattern, fact, Bindings.empty(), scratch)
                        .orElseThrow();
                    assertThat(TripleBinder.substitute(pattern, bindings)).isEqualTo(fact);
                    matched++;
                }
            }
        }
        assertThat(matched).isEqualTo(7);
    }

    @Test
    void conjunctionBindingsFollowPatternOrder() {
        List<Triple> patterns = QueryParser.parse("?a likes ?b . ?b likes cake");
        List<Triple> facts = List.of(new Triple("alice", "likes", "bob"), new Triple("bob", "likes", "cake"));

        Optional<Bindings> bindings = TripleMatcher.deriveBindings(patterns, facts, Bindings.empty());

        assertThat(bindings).isPresent();
        assertThat(bindings.get().get("a")).isEqualTo("alice");
        assertThat(bindings.get().get("b")).isEqualTo("bob");
    }

    @Test
    void conjunctionStopsWhenLaterFactDisagrees() {
        List<Triple> patterns = QueryParser.parse("?a likes ?b . ?b likes cake");
        List<Triple> facts = List.of(new Triple("alice", "likes", "bob"), new Triple("carl", "likes", "cake"));

        assertThat(TripleMatcher.deriveBindings(patterns, facts, Bindings.empty())).isEmpty();
    }

    @Test
    void conjunctionNeedsOneFactPerPattern() {
        assertThatThrownBy(() -> TripleMatcher.deriveBindings(
                List.of(new Triple("?a", "likes", "?b")), List.of(), Bindings.empty()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingArgumentsAreRejected() {
        assertThatThrownBy(() -> TripleMatcher.matches(null, ALICE_LIKES_CAKE))
            .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> TripleMatcher.deriveBindings(ALICE_LIKES_CAKE, ALICE_LIKES_CAKE, null))
            .isInstanceOf(NullPointerException.class);
    }
}
