package factstore.core.store;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.apache.jena.query.Query;
import org.apache.jena.query.QueryExecution;
import org.apache.jena.query.QueryExecutionFactory;
import org.apache.jena.query.QuerySolution;
import org.apache.jena.query.ResultSet;
import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;
import org.apache.jena.rdf.model.RDFNode;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.shared.JenaException;
import org.apache.jena.shared.Lock;
import org.apache.jena.sparql.syntax.ElementGroup;
import org.apache.jena.sparql.syntax.ElementPathBlock;

import factstore.core.triple.Bindings;
import factstore.core.triple.Primitives;
import factstore.core.triple.Triple;

/**
 * Fact backend on an in-memory Jena model.
 * Conjunctive queries are compiled to a SPARQL basic graph pattern and executed
 * by ARQ, so joins across patterns are done by Jena rather than by the core.
 * Reads and writes are serialized through the model's critical section lock.
 */
public class JenaFactBackend implements FactBackend {

    private static final Logger logger = Logger.getLogger(JenaFactBackend.class.getName());

    private final String storeName;
    private final Model model;
    private volatile boolean closed;

    public JenaFactBackend(String storeName) {
        this(storeName, ModelFactory.createDefaultModel());
    }

    /**
     * Create a backend over an existing model.
     *
     * @param storeName Name used in log messages
     * @param model Model holding the facts
     */
    public JenaFactBackend(String storeName, Model model) {
        this.storeName = Objects.requireNonNull(storeName, "Store name cannot be null");
        this.model = Objects.requireNonNull(model, "Model cannot be null");
        logger.info("Opened fact store " + storeName);
    }

    public String getStoreName() {
        return storeName;
    }

    @Override
    public List<Bindings> enumerate(List<Triple> patterns) {
        Objects.requireNonNull(patterns, "Patterns cannot be null");
        ensureOpen();
        if (patterns.isEmpty()) {
            return Collections.emptyList();
        }

        Set<String> variables = new LinkedHashSet<>();
        patterns.forEach(p -> variables.addAll(p.variables()));
        Query query = buildQuery(patterns, variables);

        if (logger.isLoggable(Level.FINE)) logger.fine("Executing SPARQL query: " + query);

        model.enterCriticalSection(Lock.READ);
        try (QueryExecution qexec = QueryExecutionFactory.create(query, model)) {
            if (variables.isEmpty()) {
                return qexec.execAsk() ? List.of(Bindings.empty()) : Collections.emptyList();
            }

            List<Bindings> results = new ArrayList<>();
            ResultSet rs = qexec.execSelect();
            while (rs.hasNext()) {
                results.add(toBindings(rs.nextSolution(), variables));
            }
            return results;
        } catch (JenaException e) {
            logger.log(Level.SEVERE, "Error querying fact store " + storeName + " with query " + query, e);
            return Collections.emptyList();
        } finally {
            model.leaveCriticalSection();
        }
    }

    @Override
    public boolean insert(Triple fact) {
        requireFact(fact);
        ensureOpen();

        model.enterCriticalSection(Lock.WRITE);
        try {
            model.add(FactEncoding.toStatement(model, fact));
            return true;
        } catch (JenaException e) {
            logger.log(Level.SEVERE, "Failed to insert " + fact + " into " + storeName, e);
            return false;
        } finally {
            model.leaveCriticalSection();
        }
    }

    @Override
    public boolean delete(Triple fact) {
        requireFact(fact);
        ensureOpen();

        // Containment check and removal happen under one write lock
        model.enterCriticalSection(Lock.WRITE);
        try {
            Statement statement = FactEncoding.toStatement(model, fact);
            if (!model.contains(statement)) {
                return false;
            }
            model.remove(statement);
            return true;
        } catch (JenaException e) {
            logger.log(Level.SEVERE, "Failed to delete " + fact + " from " + storeName, e);
            return false;
        } finally {
            model.leaveCriticalSection();
        }
    }

    @Override
    public boolean clear() {
        ensureOpen();

        model.enterCriticalSection(Lock.WRITE);
        try {
            model.removeAll();
            logger.info("Cleared fact store " + storeName);
            return true;
        } catch (JenaException e) {
            logger.log(Level.SEVERE, "Failed to clear " + storeName, e);
            return false;
        } finally {
            model.leaveCriticalSection();
        }
    }

    @Override
    public long size() {
        ensureOpen();

        model.enterCriticalSection(Lock.READ);
        try {
            return model.size();
        } finally {
            model.leaveCriticalSection();
        }
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        model.close();
        logger.info("Closed fact store " + storeName);
    }

    private Query buildQuery(List<Triple> patterns, Set<String> variables) {
        ElementPathBlock block = new ElementPathBlock();
        for (Triple pattern : patterns) {
            block.addTriple(FactEncoding.toPattern(pattern));
        }
        ElementGroup group = new ElementGroup();
        group.addElement(block);

        Query query = new Query();
        if (variables.isEmpty()) {
            query.setQueryAskType();
        } else {
            query.setQuerySelectType();
            variables.forEach(v -> query.addResultVar(Primitives.variableName(v)));
        }
        query.setQueryPattern(group);
        return query;
    }

    private Bindings toBindings(QuerySolution solution, Set<String> variables) {
        Bindings.Builder builder = Bindings.builder();
        for (String variable : variables) {
            RDFNode node = solution.get(Primitives.variableName(variable));
            if (node == null) {
                continue;
            }
            String value = FactEncoding.fromNode(node);
            if (value.isBlank()) {
                logger.warning("Skipping blank value for " + variable + " in " + storeName);
                continue;
            }
            builder.bind(variable, value);
        }
        return builder.build();
    }

    private static void requireFact(Triple fact) {
        Objects.requireNonNull(fact, "Fact cannot be null");
        if (fact.isPattern()) {
            throw new IllegalArgumentException("Only concrete facts can be stored: " + fact);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Fact store " + storeName + " is closed");
        }
    }

    @Override
    public String toString() {
        return "JenaFactBackend{" + storeName + (closed ? ", closed" : "") + "}";
    }
}
