package org.Aayush.slicecache.signature;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Structured cache-validity fingerprint: a core hash plus one definition hash per dimension key.
 *
 * <p>Malformed or legacy inputs become the {@link Kind#UNPARSEABLE} sentinel, which has an empty
 * core hash and is never compatible with anything, itself included.</p>
 */
public final class CacheSignature {

    /**
     * Signature variant.
     */
    public enum Kind {
        STRUCTURED,
        UNPARSEABLE
    }

    private static final CacheSignature UNPARSEABLE =
            new CacheSignature(Kind.UNPARSEABLE, "", Collections.emptySortedMap());

    private final Kind kind;
    private final String coreHash;
    private final Map<String, String> dimensionHashes;

    private CacheSignature(Kind kind, String coreHash, Map<String, String> dimensionHashes) {
        this.kind = kind;
        this.coreHash = coreHash;
        this.dimensionHashes = dimensionHashes;
    }

    /**
     * Creates a structured signature.
     *
     * @param coreHash non-blank core fingerprint.
     * @param dimensionHashes dimension key to definition fingerprint; keys are lower-cased.
     */
    public static CacheSignature of(String coreHash, Map<String, String> dimensionHashes) {
        String core = Objects.requireNonNull(coreHash, "coreHash").trim();
        if (core.isEmpty()) {
            throw new IllegalArgumentException("coreHash must be non-blank; use unparseable() for the sentinel");
        }
        TreeMap<String, String> sorted = new TreeMap<>();
        if (dimensionHashes != null) {
            for (Map.Entry<String, String> entry : dimensionHashes.entrySet()) {
                String key = Objects.requireNonNull(entry.getKey(), "dimension key").trim().toLowerCase(Locale.ROOT);
                sorted.put(key, Objects.requireNonNull(entry.getValue(), "hash for " + key));
            }
        }
        return new CacheSignature(Kind.STRUCTURED, core, Collections.unmodifiableSortedMap(sorted));
    }

    /**
     * Creates a structured signature with no dimension hashes.
     */
    public static CacheSignature of(String coreHash) {
        return of(coreHash, Map.of());
    }

    /**
     * Returns the shared parse-failure sentinel.
     */
    public static CacheSignature unparseable() {
        return UNPARSEABLE;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isUnparseable() {
        return kind == Kind.UNPARSEABLE;
    }

    public String coreHash() {
        return coreHash;
    }

    /**
     * Returns the sorted, immutable dimension-hash view.
     */
    public Map<String, String> dimensionHashes() {
        return dimensionHashes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CacheSignature)) {
            return false;
        }
        CacheSignature other = (CacheSignature) o;
        return kind == other.kind
                && coreHash.equals(other.coreHash)
                && dimensionHashes.equals(other.dimensionHashes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, coreHash, dimensionHashes);
    }

    @Override
    public String toString() {
        if (isUnparseable()) {
            return "CacheSignature[UNPARSEABLE]";
        }
        return "CacheSignature[core=" + coreHash + ", dims=" + dimensionHashes + "]";
    }
}
