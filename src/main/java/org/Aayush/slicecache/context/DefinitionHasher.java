package org.Aayush.slicecache.context;

import org.Aayush.slicecache.signature.CacheSignature;
import org.Aayush.slicecache.signature.CanonicalHashing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Fingerprints a context definition for use as a dimension hash.
 *
 * <p>Two definitions hash equally iff they agree on key, policy, expected value set and
 * catch-all id. Declaration order and aliases do not contribute.</p>
 */
public final class DefinitionHasher {

    /**
     * Returns lower-case hex SHA-256 of the canonical definition.
     */
    public String hash(ContextDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        LinkedHashMap<String, Object> canonical = new LinkedHashMap<>();
        canonical.put("key", definition.getKey().trim().toLowerCase(Locale.ROOT));
        canonical.put("policy", definition.policy().name());
        canonical.put("values", new ArrayList<>(definition.expectedValues()));
        canonical.put("otherId", definition.catchAll());
        return CanonicalHashing.sha256Hex(canonical);
    }

    /**
     * Returns dimension hashes for every definition the registry knows among {@code keys}.
     *
     * @throws IllegalArgumentException when a key has no definition.
     */
    public Map<String, String> hashes(ContextRegistry registry, Iterable<String> keys) {
        LinkedHashMap<String, String> hashes = new LinkedHashMap<>();
        for (String key : keys) {
            ContextDefinition definition = registry.definition(key);
            if (definition == null) {
                throw new IllegalArgumentException("no context definition for dimension " + key);
            }
            hashes.put(key, hash(definition));
        }
        return hashes;
    }

    /**
     * Returns the signature a slice fetched for {@code keys} must carry under {@code query}.
     *
     * <p>Keys the query already fingerprints keep the query's hash; every other key gets the
     * hash of its registered definition.</p>
     *
     * @throws IllegalArgumentException when the query is unparseable or a key has no definition.
     */
    public CacheSignature signatureFor(CacheSignature query, ContextRegistry registry, Iterable<String> keys) {
        Objects.requireNonNull(query, "query");
        Objects.requireNonNull(registry, "registry");
        if (query.isUnparseable()) {
            throw new IllegalArgumentException("cannot derive a slice signature from the unparseable signature");
        }
        TreeMap<String, String> hashes = new TreeMap<>(query.dimensionHashes());
        List<String> unsigned = new ArrayList<>();
        for (String key : keys) {
            if (!hashes.containsKey(key.trim().toLowerCase(Locale.ROOT))) {
                unsigned.add(key);
            }
        }
        hashes.putAll(hashes(registry, unsigned));
        return CacheSignature.of(query.coreHash(), hashes);
    }
}
