package factstore.core.store;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import factstore.core.triple.Bindings;
import factstore.core.triple.Primitives;
import factstore.core.triple.Triple;
import factstore.core.triple.TripleBinder;

/**
 * Triple store on top of a {@link FactBackend}.
 * The backend enumerates solutions; removals are reported by substituting each
 * solution back into the query patterns.
 */
public class DefaultTripleStore implements TripleStore {

    private static final Logger logger = Logger.getLogger(DefaultTripleStore.class.getName());

    private static final Triple ALL = new Triple(
        Primitives.asVariable("a"), Primitives.asVariable("b"), Primitives.asVariable("c"));

    private final FactBackend backend;

    public DefaultTripleStore(FactBackend backend) {
        this.backend = Objects.requireNonNull(backend, "Backend cannot be null");
    }

    @Override
    public long count() {
        return backend.size();
    }

    @Override
    public boolean add(Triple fact) {
        Objects.requireNonNull(fact, "Fact cannot be null");
        if (fact.isPattern()) {
            throw new IllegalArgumentException("Cannot add a pattern to the store: " + fact);
        }
        boolean added = backend.insert(fact);
        if (!added) {
            logger.warning("Backend rejected " + fact);
        }
        return added;
    }

    @Override
    public boolean contains(Triple fact) {
        Objects.requireNonNull(fact, "Fact cannot be null");
        List<Bindings> bindings = backend.enumerate(fact);
        return bindings.size() == 1 && bindings.get(0).isEmpty();
    }

    @Override
    public List<Bindings> query(List<Triple> patterns) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        return backend.enumerate(patterns);
    }

    @Override
    public Set<Triple> remove(List<Triple> patterns) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        if (patterns.size() == 1) {
            return remove(patterns.get(0));
        }

        Set<Triple> removed = new HashSet<>();
        if (patterns.isEmpty()) {
            return removed;
        }

        for (Bindings bindings : backend.enumerate(patterns)) {
            for (Triple fact : TripleBinder.substituteAll(patterns, bindings)) {
                removeFact(fact, removed);
            }
        }
        return removed;
    }

    @Override
    public Set<Triple> remove(Triple pattern) {
        Objects.requireNonNull(pattern, "Pattern cannot be null");
        Set<Triple> removed = new HashSet<>();

        if (!pattern.isPattern()) {
            removeFact(pattern, removed);
        } else if (pattern.isWildcard()) {
            removed = all();
            if (!backend.clear()) {
                logger.warning("Failed to clear store, reported facts may still be present");
            }
        } else {
            for (Bindings bindings : backend.enumerate(pattern)) {
                removeFact(TripleBinder.substitute(pattern, bindings), removed);
            }
        }

        if (logger.isLoggable(Level.FINE)) logger.fine("Removed " + removed.size() + " facts for " + pattern);
        return removed;
    }

    @Override
    public Set<Triple> all() {
        Set<Triple> result = new HashSet<>();
        for (Bindings bindings : backend.enumerate(ALL)) {
            result.add(TripleBinder.substitute(ALL, bindings));
        }
        return result;
    }

    @Override
    public void close() {
        backend.close();
    }

    private void removeFact(Triple fact, Set<Triple> removed) {
        if (fact.isPattern()) {
            return; // unbound variable left, nothing concrete to delete
        }
        if (backend.delete(fact)) {
            removed.add(fact);
        }
    }
}
