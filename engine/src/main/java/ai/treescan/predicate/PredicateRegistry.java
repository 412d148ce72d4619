package ai.treescan.predicate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The predicate names a query compiler recognizes. The set is closed: a clause whose name is not registered fails
 * compilation. It is extended by building a new registry with additional factories, never by mutating one in use.
 */
public final class PredicateRegistry {
    private final Map<String, PredicateFactory> factories;

    private PredicateRegistry(Map<String, PredicateFactory> factories) {
        this.factories = Map.copyOf(factories);
    }

    private static final PredicateRegistry DEFAULTS = new Builder()
            .register("eq", (name, args) -> EqPredicate.create(name, args, false))
            .register("not-eq", (name, args) -> EqPredicate.create(name, args, true))
            .register("match", (name, args) -> MatchPredicate.create(name, args, false))
            .register("not-match", (name, args) -> MatchPredicate.create(name, args, true))
            .register("any-of", (name, args) -> AnyOfPredicate.create(name, args, false))
            .register("not-any-of", (name, args) -> AnyOfPredicate.create(name, args, true))
            .register("has-child", (name, args) -> HasChildPredicate.create(name, args, false))
            .register("not-has-child", (name, args) -> HasChildPredicate.create(name, args, true))
            .build();

    /** {@code eq}, {@code match}, {@code any-of}, {@code has-child} and their {@code not-} forms. */
    public static PredicateRegistry defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder seeded with this registry's entries. */
    public Builder toBuilder() {
        var builder = new Builder();
        builder.factories.putAll(factories);
        return builder;
    }

    public Optional<PredicateFactory> factory(String name) {
        return Optional.ofNullable(factories.get(name));
    }

    public boolean isRegistered(String name) {
        return factories.containsKey(name);
    }

    public Set<String> names() {
        return factories.keySet();
    }

    public static final class Builder {
        private final Map<String, PredicateFactory> factories = new LinkedHashMap<>();

        private Builder() {}

        /**
         * @param name clause name without {@code #} and {@code ?}
         * @throws IllegalArgumentException if the name is malformed or already registered
         */
        public Builder register(String name, PredicateFactory factory) {
            if (!name.matches("[A-Za-z][A-Za-z0-9_-]*")) {
                throw new IllegalArgumentException("Invalid predicate name '" + name + "'");
            }
            if (factories.putIfAbsent(name, factory) != null) {
                throw new IllegalArgumentException("Predicate #" + name + "? is already registered");
            }
            return this;
        }

        public PredicateRegistry build() {
            return new PredicateRegistry(factories);
        }
    }
}
