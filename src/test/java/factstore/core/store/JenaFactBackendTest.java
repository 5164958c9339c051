package factstore.core.store;

import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import factstore.core.triple.Bindings;
import factstore.core.triple.QueryParser;
import factstore.core.triple.Triple;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JenaFactBackendTest {

    private JenaFactBackend backend;

    @BeforeEach
    void setUp() {
        backend = new JenaFactBackend("test");
        backend.insert(new Triple("alice", "likes", "bob"));
        backend.insert(new Triple("bob", "likes", "cake"));
        backend.insert(new Triple("carl", "likes", "dave"));
    }

    @AfterEach
    void tearDown() {
        backend.close();
    }

    @Test
    void enumeratesSinglePattern() {
        List<Bindings> results = backend.enumerate(new Triple("?who", "likes", "cake"));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).get("who")).isEqualTo("bob");
    }

    @Test
    void joinsSharedVariablesAcrossPatterns() {
        List<Bindings> results = backend.enumerate(QueryParser.parse("?a likes ?b . ?b likes cake"));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).get("a")).isEqualTo("alice");
        assertThat(results.get(0).get("b")).isEqualTo("bob");
    }

    @Test
    void concretePatternYieldsOneEmptySolutionWhenStored() {
        assertThat(backend.enumerate(new Triple("alice", "likes", "bob")))
            .containsExactly(Bindings.empty());
        assertThat(backend.enumerate(new Triple("alice", "likes", "cake"))).isEmpty();
    }

    @Test
    void repeatedVariableNeedsEqualValues() {
        backend.insert(new Triple("narcissus", "loves", "narcissus"));

        List<Bindings> results = backend.enumerate(new Triple("?x", "?p", "?x"));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).get("x")).isEqualTo("narcissus");
        assertThat(results.get(0).get("p")).isEqualTo("loves");
    }

    @Test
    void valuesWithSpacesRoundTrip() {
        backend.insert(new Triple("alice", "says", "'Hello World'"));

        List<Bindings> results = backend.enumerate(new Triple("alice", "says", "?what"));

        assertThat(results).hasSize(1);
        assertThat(results.get(0).get("what")).isEqualTo("hello world");
    }

    @Test
    void emptyConjunctionHasNoSolutions() {
        assertThat(backend.enumerate(List.of())).isEmpty();
    }

    @Test
    void deleteReportsWhetherFactWasStored() {
        assertThat(backend.delete(new Triple("alice", "likes", "bob"))).isTrue();
        assertThat(backend.delete(new Triple("alice", "likes", "bob"))).isFalse();
        assertThat(backend.size()).isEqualTo(2);
    }

    @Test
    void clearRemovesEverything() {
        assertThat(backend.clear()).isTrue();
        assertThat(backend.size()).isZero();
    }

    @Test
    void onlyConcreteFactsCanBeStored() {
        assertThatThrownBy(() -> backend.insert(new Triple("?a", "likes", "cake")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> backend.delete(new Triple("?a", "likes", "cake")))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closedBackendRejectsCalls() {
        backend.close();
        backend.close();

        assertThatThrownBy(() -> backend.enumerate(new Triple("?a", "?b", "?c")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("test");
        assertThatThrownBy(() -> backend.insert(new Triple("a", "b", "c")))
            .isInstanceOf(IllegalStateException.class);
    }
}
