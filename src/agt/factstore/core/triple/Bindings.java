package factstore.core.triple;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable set of variable bindings.
 * Keys are canonical variable names ({@code ?name}); lookups accept names with
 * or without the prefix. When the same variable is supplied twice the first
 * binding wins, which lets a new set be layered over an older one without ever
 * overriding what the older set fixed.
 */
public final class Bindings implements Iterable<Bindings.Binding> {

    /**
     * A single variable bound to a value.
     */
    public static final class Binding {
        private final String name;
        private final String value;

        /**
         * @param name Variable name, with or without prefix
         * @param value Bound value
         */
        public Binding(String name, String value) {
            Objects.requireNonNull(name, "Name cannot be null");
            Objects.requireNonNull(value, "Value cannot be null");
            if (value.isBlank()) {
                throw new TripleFormatException("Value of " + name + " must be a non-empty string");
            }
            this.name = canonical(name);
            this.value = value;
        }

        public String getName() { return name; }
        public String getValue() { return value; }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Binding)) return false;
            Binding other = (Binding) obj;
            return name.equals(other.name) && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, value);
        }

        @Override
        public String toString() {
            return name + " = " + value;
        }
    }

    private static final Bindings EMPTY = new Bindings(new LinkedHashMap<>());

    private final Map<String, Binding> bindings;

    private Bindings(LinkedHashMap<String, Binding> bindings) {
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    static String canonical(String name) {
        return Primitives.asVariable(name).toLowerCase(Locale.ROOT);
    }

    /**
     * The set without any binding.
     */
    public static Bindings empty() {
        return EMPTY;
    }

    /**
     * Build a set from a collection. Later duplicates of a name are dropped.
     */
    public static Bindings of(Collection<Binding> bindings) {
        Objects.requireNonNull(bindings, "Bindings cannot be null");
        LinkedHashMap<String, Binding> map = new LinkedHashMap<>();
        addAbsent(map, bindings);
        return new Bindings(map);
    }

    /**
     * Build a set from a name to value map.
     */
    public static Bindings of(Map<String, String> values) {
        Objects.requireNonNull(values, "Values cannot be null");
        List<Binding> list = new ArrayList<>(values.size());
        values.forEach((name, value) -> list.add(new Binding(name, value)));
        return of(list);
    }

    /**
     * Layer additions on top of an existing set. Names already bound in
     * {@code base} keep their value; {@code base} itself is left untouched.
     *
     * @param base Established bindings
     * @param additions New bindings, applied only for names absent from base
     * @return A new set holding both
     */
    public static Bindings layered(Bindings base, Collection<Binding> additions) {
        Objects.requireNonNull(base, "Base bindings cannot be null");
        Objects.requireNonNull(additions, "Additional bindings cannot be null");
        if (additions.isEmpty()) {
            return base;
        }

        // Phase 1: everything the base fixed
        LinkedHashMap<String, Binding> map = new LinkedHashMap<>(base.bindings);
        // Phase 2: additions only where nothing is bound yet
        addAbsent(map, additions);
        return new Bindings(map);
    }

    private static void addAbsent(Map<String, Binding> target, Collection<Binding> source) {
        for (Binding binding : source) {
            Objects.requireNonNull(binding, "Binding cannot be null");
            target.putIfAbsent(binding.getName(), binding);
        }
    }

    /**
     * Look up the value of a variable.
     *
     * @param name Variable name, with or without prefix
     * @return The bound value, or empty if unbound
     */
    public Optional<String> lookup(String name) {
        return Optional.ofNullable(get(name));
    }

    /**
     * @return The bound value, or null if unbound
     */
    public String get(String name) {
        Binding binding = bindings.get(canonical(name));
        return binding == null ? null : binding.getValue();
    }

    public boolean contains(String name) {
        return bindings.containsKey(canonical(name));
    }

    public int size() {
        return bindings.size();
    }

    public boolean isEmpty() {
        return bindings.isEmpty();
    }

    /**
     * Canonical names of all bound variables, in insertion order.
     */
    public Set<String> names() {
        return bindings.keySet();
    }

    /**
     * Unmodifiable name to value view.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(bindings.values().stream()
            .collect(Collectors.toMap(Binding::getName, Binding::getValue,
                (a, b) -> a, LinkedHashMap::new)));
    }

    @Override
    public Iterator<Binding> iterator() {
        return bindings.values().iterator();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Bindings)) return false;
        return bindings.equals(((Bindings) obj).bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return bindings.values().stream()
            .map(Binding::toString)
            .collect(Collectors.joining(", ", "Bindings = {", "}"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Collects bindings one at a time, e.g. while reading a result row.
     */
    public static class Builder {
        private final List<Binding> bindings = new ArrayList<>();

        public Builder bind(String name, String value) {
            bindings.add(new Binding(name, value));
            return this;
        }

        public Builder add(Binding binding) {
            bindings.add(Objects.requireNonNull(binding, "Binding cannot be null"));
            return this;
        }

        public Bindings build() {
            return bindings.isEmpty() ? EMPTY : of(bindings);
        }
    }
}
