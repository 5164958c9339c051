package factstore.core.store;

import java.util.Objects;
import java.util.logging.Logger;

import org.apache.jena.rdf.model.Model;
import org.apache.jena.rdf.model.ModelFactory;

import factstore.capabilities.ConfigResolver;

/**
 * Entry points for opening triple stores.
 */
public final class TripleStores {

    private static final Logger logger = Logger.getLogger(TripleStores.class.getName());

    private TripleStores() {}

    /**
     * Open an empty in-memory store with default configuration.
     */
    public static TripleStore inMemory() {
        return open(StoreConfiguration.defaults());
    }

    public static TripleStore open(StoreConfiguration config) {
        return open(config, ModelFactory.createDefaultModel());
    }

    /**
     * Open a store over an existing Jena model.
     *
     * @param config Store configuration
     * @param model Model holding the facts, cleared first if the configuration says so
     * @return The store
     */
    public static TripleStore open(StoreConfiguration config, Model model) {
        Objects.requireNonNull(config, "Configuration cannot be null");
        JenaFactBackend backend = new JenaFactBackend(config.getStoreName(), model);

        if (config.isClearOnOpen() && !backend.clear()) {
            logger.warning("Could not clear store " + config.getStoreName() + " on open");
        }
        return new DefaultTripleStore(backend);
    }

    /**
     * Open a store configured from environment, system properties and {@code .env}.
     */
    public static TripleStore fromEnvironment() {
        ConfigResolver.enableDotenv();
        StoreConfiguration config = StoreConfiguration.fromEnvironment().build();
        logger.info("Opening store with " + config);
        return open(config);
    }
}
