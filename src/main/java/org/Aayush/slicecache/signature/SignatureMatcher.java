package org.Aayush.slicecache.signature;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Decides whether a cached signature can answer a query signature.
 *
 * <p>Rules, in order:</p>
 * <ol>
 * <li>Either side unparseable: {@code UNPARSEABLE_SIGNATURE}.</li>
 * <li>Core hashes differ: {@code CORE_MISMATCH}.</li>
 * <li>For each query dimension key in sorted order, the cache must carry the key
 * ({@code MISSING_DIMENSION}) with an equal hash ({@code DIMENSION_DEFINITION_CHANGED}).</li>
 * </ol>
 * <p>Extra cache dimension keys are allowed; that is what makes superset slices reusable.</p>
 */
public final class SignatureMatcher {

    /**
     * Compares a cached signature against a query signature.
     */
    public SignatureMatch canSatisfy(CacheSignature cache, CacheSignature query) {
        Objects.requireNonNull(cache, "cache");
        Objects.requireNonNull(query, "query");
        if (cache.isUnparseable() || query.isUnparseable()) {
            return SignatureMatch.unparseable();
        }
        if (!cache.coreHash().equals(query.coreHash())) {
            return SignatureMatch.coreMismatch();
        }
        Map<String, String> cacheHashes = cache.dimensionHashes();
        for (Map.Entry<String, String> entry : query.dimensionHashes().entrySet()) {
            String cached = cacheHashes.get(entry.getKey());
            if (cached == null) {
                return SignatureMatch.missingDimension(entry.getKey());
            }
            if (!cached.equals(entry.getValue())) {
                return SignatureMatch.dimensionDefinitionChanged(entry.getKey());
            }
        }
        return SignatureMatch.compatible();
    }

    /**
     * Returns cache dimension keys the query does not mention, sorted.
     */
    public Set<String> unspecifiedDimensions(CacheSignature cache, CacheSignature query) {
        if (cache.isUnparseable() || query.isUnparseable()) {
            return Set.of();
        }
        TreeSet<String> extra = new TreeSet<>(cache.dimensionHashes().keySet());
        extra.removeAll(query.dimensionHashes().keySet());
        return Collections.unmodifiableSet(extra);
    }
}
