package org.Aayush.slicecache.context;

import org.Aayush.slicecache.dimension.DimensionAssignment;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable context-definition catalog.
 *
 * <p>Keys are normalised like assignment keys. When two definitions share a key the later one
 * wins, so callers can layer overrides on top of a base set.</p>
 */
public final class InMemoryContextRegistry implements ContextRegistry {
    private final Map<String, ContextDefinition> definitionsByKey;

    /**
     * Creates an empty registry.
     */
    public InMemoryContextRegistry() {
        this.definitionsByKey = Map.of();
    }

    /**
     * Creates a registry from the given definitions, validated by the default MECE policy.
     */
    public InMemoryContextRegistry(Collection<ContextDefinition> definitions) {
        this(definitions, MecePolicy.defaults());
    }

    /**
     * Creates a registry from the given definitions.
     *
     * @throws MecePolicy.DefinitionException when a definition is invalid.
     */
    public InMemoryContextRegistry(Collection<ContextDefinition> definitions, MecePolicy policy) {
        this.definitionsByKey = Map.copyOf(materialize(definitions, Objects.requireNonNull(policy, "policy")));
    }

    /**
     * Returns a registry containing this catalog's definitions overridden by {@code overrides}.
     */
    public InMemoryContextRegistry withOverrides(Collection<ContextDefinition> overrides) {
        LinkedHashMap<String, ContextDefinition> merged = new LinkedHashMap<>(definitionsByKey);
        if (overrides != null) {
            merged.putAll(materialize(overrides, MecePolicy.defaults()));
        }
        return new InMemoryContextRegistry(List.copyOf(merged.values()));
    }

    @Override
    public ContextDefinition definition(String key) {
        if (key == null || key.isBlank()) {
            return null;
        }
        return definitionsByKey.get(DimensionAssignment.normalizeKey(key));
    }

    /**
     * Returns immutable set of registered keys.
     */
    public Set<String> keys() {
        return definitionsByKey.keySet();
    }

    private static LinkedHashMap<String, ContextDefinition> materialize(
            Collection<ContextDefinition> definitions,
            MecePolicy policy
    ) {
        Objects.requireNonNull(definitions, "definitions");
        LinkedHashMap<String, ContextDefinition> map = new LinkedHashMap<>();
        for (ContextDefinition definition : definitions) {
            policy.validateDefinition(definition);
            String key = DimensionAssignment.normalizeKey(definition.getKey());
            ContextDefinition normalized = key.equals(definition.getKey())
                    ? definition
                    : definition.toBuilder().key(key).build();
            map.put(key, normalized);
        }
        return map;
    }
}
