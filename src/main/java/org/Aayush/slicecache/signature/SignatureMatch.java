package org.Aayush.slicecache.signature;

/**
 * Verdict of one cache-versus-query signature comparison.
 *
 * @param verdict comparison verdict.
 * @param dimensionKey offending dimension key for dimension verdicts, otherwise {@code null}.
 */
public record SignatureMatch(Verdict verdict, String dimensionKey) {
    private static final SignatureMatch COMPATIBLE = new SignatureMatch(Verdict.COMPATIBLE, null);
    private static final SignatureMatch CORE_MISMATCH = new SignatureMatch(Verdict.CORE_MISMATCH, null);
    private static final SignatureMatch UNPARSEABLE = new SignatureMatch(Verdict.UNPARSEABLE_SIGNATURE, null);

    /**
     * Comparison verdicts.
     */
    public enum Verdict {
        COMPATIBLE,
        CORE_MISMATCH,
        MISSING_DIMENSION,
        DIMENSION_DEFINITION_CHANGED,
        UNPARSEABLE_SIGNATURE
    }

    public static SignatureMatch compatible() {
        return COMPATIBLE;
    }

    public static SignatureMatch coreMismatch() {
        return CORE_MISMATCH;
    }

    public static SignatureMatch unparseable() {
        return UNPARSEABLE;
    }

    public static SignatureMatch missingDimension(String key) {
        return new SignatureMatch(Verdict.MISSING_DIMENSION, key);
    }

    public static SignatureMatch dimensionDefinitionChanged(String key) {
        return new SignatureMatch(Verdict.DIMENSION_DEFINITION_CHANGED, key);
    }

    public boolean isCompatible() {
        return verdict == Verdict.COMPATIBLE;
    }

    /**
     * Returns a short diagnostic label, for example {@code MISSING_DIMENSION(device)}.
     */
    public String describe() {
        return dimensionKey == null ? verdict.name() : verdict.name() + "(" + dimensionKey + ")";
    }
}
