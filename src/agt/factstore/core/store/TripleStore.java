package factstore.core.store;

import java.util.List;
import java.util.Set;

import factstore.core.triple.Bindings;
import factstore.core.triple.QueryParser;
import factstore.core.triple.Triple;

/**
 * Store of facts that answers pattern queries with variable bindings.
 * Query strings use the {@link QueryParser} format, e.g. {@code "?a likes ?b . ?b likes cake"}.
 */
public interface TripleStore extends AutoCloseable {

    /**
     * @return Number of stored facts
     */
    long count();

    // ========== Insertion ==========

    /**
     * Store a concrete fact.
     *
     * @param fact Fact without variables
     * @return True if the fact was stored
     * @throws IllegalArgumentException if the triple is a pattern
     */
    boolean add(Triple fact);

    default boolean add(String id, String predicate, String object) {
        return add(new Triple(id, predicate, object));
    }

    /**
     * Check if a specific fact is stored.
     */
    boolean contains(Triple fact);

    // ========== Query ==========

    /**
     * Solve a conjunction of patterns.
     *
     * @param patterns Patterns that must all hold
     * @return One bindings set per solution
     */
    List<Bindings> query(List<Triple> patterns);

    default List<Bindings> query(Triple pattern) {
        return query(List.of(pattern));
    }

    default List<Bindings> query(String id, String predicate, String object) {
        return query(new Triple(id, predicate, object));
    }

    default List<Bindings> query(String query) {
        return query(QueryParser.parse(query));
    }

    // ========== Removal ==========

    /**
     * Remove every fact produced by substituting a solution of the conjunction
     * into its patterns.
     *
     * @param patterns Patterns that must all hold
     * @return Facts that were actually removed
     */
    Set<Triple> remove(List<Triple> patterns);

    /**
     * Remove a single fact, or every fact matching a pattern.
     *
     * @return Facts that were actually removed
     */
    Set<Triple> remove(Triple pattern);

    default Set<Triple> remove(String id, String predicate, String object) {
        return remove(new Triple(id, predicate, object));
    }

    default Set<Triple> remove(String query) {
        return remove(QueryParser.parse(query));
    }

    /**
     * Get all stored facts.
     * WARNING: Materializes the whole store.
     */
    Set<Triple> all();

    @Override
    void close();
}
