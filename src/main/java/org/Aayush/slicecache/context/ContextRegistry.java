package org.Aayush.slicecache.context;

/**
 * Read-only view over context definitions.
 *
 * <p>Implementations are assumed eventually consistent; callers may cache lookups for the
 * duration of one planning pass.</p>
 */
public interface ContextRegistry {

    /**
     * Returns the definition for a dimension key, or {@code null} when unknown.
     *
     * @param key dimension key in any case.
     */
    ContextDefinition definition(String key);
}
