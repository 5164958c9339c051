package factstore.core.store;

import java.util.Objects;

import factstore.capabilities.ConfigResolver;

/**
 * Configuration for opening a triple store.
 *
 * Supports configuration via:
 * - Direct builder pattern
 * - Environment variables, system properties, or .env ({@link #fromEnvironment()})
 */
public class StoreConfiguration {

    /** Key for the store name */
    public static final String STORE_NAME_KEY = "FACTSTORE_NAME";

    /** Key for the clear-on-open flag */
    public static final String CLEAR_ON_OPEN_KEY = "FACTSTORE_CLEAR_ON_OPEN";

    public static final String DEFAULT_STORE_NAME = "default";

    private final String storeName;
    private final boolean clearOnOpen;

    private StoreConfiguration(Builder builder) {
        this.storeName = builder.storeName;
        this.clearOnOpen = builder.clearOnOpen;
    }

    public String getStoreName() {
        return storeName;
    }

    public boolean isClearOnOpen() {
        return clearOnOpen;
    }

    /**
     * Default configuration: store named {@value #DEFAULT_STORE_NAME}, kept on open.
     */
    public static StoreConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Create a builder initialized from resolved configuration keys.
     *
     * Looks for:
     * - FACTSTORE_NAME
     * - FACTSTORE_CLEAR_ON_OPEN
     */
    public static Builder fromEnvironment() {
        return builder()
            .storeName(ConfigResolver.resolve(STORE_NAME_KEY, DEFAULT_STORE_NAME))
            .clearOnOpen(ConfigResolver.resolveBoolean(CLEAR_ON_OPEN_KEY, false));
    }

    @Override
    public String toString() {
        return "StoreConfiguration{" +
            "storeName='" + storeName + '\'' +
            ", clearOnOpen=" + clearOnOpen +
            '}';
    }

    public static class Builder {
        private String storeName = DEFAULT_STORE_NAME;
        private boolean clearOnOpen = false;

        public Builder storeName(String storeName) {
            Objects.requireNonNull(storeName, "Store name cannot be null");
            if (storeName.isBlank()) {
                throw new IllegalArgumentException("Store name must be a non-empty string");
            }
            this.storeName = storeName.trim();
            return this;
        }

        /**
         * Remove all facts when the store is opened.
         */
        public Builder clearOnOpen(boolean clearOnOpen) {
            this.clearOnOpen = clearOnOpen;
            return this;
        }

        public StoreConfiguration build() {
            return new StoreConfiguration(this);
        }
    }
}
