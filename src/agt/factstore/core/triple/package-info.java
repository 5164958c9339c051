/**
 * Triple model and matching core - pure, synchronous, storage-agnostic.
 *
 * <h2>Overview</h2>
 * Facts and query patterns share one representation, {@link factstore.core.triple.Triple}:
 * each slot holds a normalized primitive, and a primitive starting with {@code ?} is a
 * variable. Matching a pattern against a fact yields {@link factstore.core.triple.Bindings},
 * and bindings substituted back into the pattern give the fact again.
 *
 * <h2>Main Components</h2>
 * <ul>
 *   <li>{@link factstore.core.triple.Primitives} - Normalization and variable naming</li>
 *   <li>{@link factstore.core.triple.Triple} - Immutable fact or pattern</li>
 *   <li>{@link factstore.core.triple.Bindings} - Immutable, first-write-wins variable bindings</li>
 *   <li>{@link factstore.core.triple.QueryParser} - Text query to ordered list of patterns</li>
 *   <li>{@link factstore.core.triple.TripleMatcher} - Pattern/fact matching and binding derivation</li>
 *   <li>{@link factstore.core.triple.TripleBinder} - Substitution of bindings into patterns</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Triple> query = QueryParser.parse("?who likes ?what . ?what is sweet");
 * Triple fact = new Triple("Alice", "likes", "cake");
 *
 * Optional<Bindings> bindings = TripleMatcher.deriveBindings(query.get(0), fact, Bindings.empty());
 * bindings.ifPresent(b -> {
 *     Triple next = TripleBinder.substitute(query.get(1), b); // (cake, is, sweet)
 * });
 * }</pre>
 *
 * Instances of {@code Triple} and {@code Bindings} are immutable and may be shared
 * between threads. A {@link factstore.core.triple.MatchScratch} may not.
 */
package factstore.core.triple;
