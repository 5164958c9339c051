package factstore.core.store;

import java.util.List;

import factstore.core.triple.Bindings;
import factstore.core.triple.Triple;

/**
 * Storage collaborator behind a {@link TripleStore}.
 * Holds the facts and executes conjunctive queries over them; the core only
 * consumes the resulting bindings and a success flag for updates.
 */
public interface FactBackend extends AutoCloseable {

    // ========== Enumeration ==========

    /**
     * Find all solutions of a conjunction of patterns over the stored facts.
     *
     * @param patterns Patterns that must all hold; variables shared between
     *                 patterns must take the same value
     * @return One bindings set per solution. For patterns without variables this is
     *         a single empty set when every fact is stored, and an empty list otherwise
     */
    List<Bindings> enumerate(List<Triple> patterns);

    /**
     * Find all solutions of a single pattern.
     */
    default List<Bindings> enumerate(Triple pattern) {
        return enumerate(List.of(pattern));
    }

    // ========== Persistence ==========

    /**
     * Store a concrete fact.
     *
     * @param fact Fact without variables
     * @return True if the backend accepted the update
     */
    boolean insert(Triple fact);

    /**
     * Delete a concrete fact.
     *
     * @param fact Fact without variables
     * @return True if the fact was stored and has been deleted
     */
    boolean delete(Triple fact);

    /**
     * Remove every fact.
     *
     * @return True if the backend accepted the update
     */
    boolean clear();

    /**
     * @return Number of stored facts
     */
    long size();

    /**
     * Release the backend. Further calls fail with {@link IllegalStateException}.
     */
    @Override
    void close();
}
