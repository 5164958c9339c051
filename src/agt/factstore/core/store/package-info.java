/**
 * Triple store facade and its storage backend.
 * {@link factstore.core.store.TripleStore} is the public API;
 * {@link factstore.core.store.FactBackend} is the storage contract, implemented
 * by {@link factstore.core.store.JenaFactBackend} on an in-memory Jena model.
 *
 * <pre>{@code
 * try (TripleStore store = TripleStores.inMemory()) {
 *     store.add("alice", "likes", "bob");
 *     store.add("bob", "likes", "cake");
 *     List<Bindings> answers = store.query("?a likes ?b . ?b likes cake");
 *     Set<Triple> removed = store.remove("?a likes cake");
 * }
 * }</pre>
 */
package factstore.core.store;
