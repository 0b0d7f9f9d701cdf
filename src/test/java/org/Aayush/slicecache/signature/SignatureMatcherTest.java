package org.Aayush.slicecache.signature;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SignatureMatcher and CoreHashBuilder Tests")
class SignatureMatcherTest {

    private final SignatureMatcher matcher = new SignatureMatcher();

    @Test
    @DisplayName("Cache with extra dimensions satisfies a narrower query")
    void testSupersetCompatible() {
        CacheSignature cache = CacheSignature.of("core", Map.of("channel", "c1", "device", "d1"));
        CacheSignature query = CacheSignature.of("core", Map.of("channel", "c1"));

        SignatureMatch match = matcher.canSatisfy(cache, query);
        assertTrue(match.isCompatible());
        assertEquals("COMPATIBLE", match.describe());
        assertEquals(Set.of("device"), matcher.unspecifiedDimensions(cache, query));
    }

    @Test
    @DisplayName("Core mismatch is reported before dimension checks")
    void testCoreMismatch() {
        CacheSignature cache = CacheSignature.of("core-a", Map.of());
        CacheSignature query = CacheSignature.of("core-b", Map.of("channel", "c1"));

        assertEquals(SignatureMatch.Verdict.CORE_MISMATCH, matcher.canSatisfy(cache, query).verdict());
    }

    @Test
    @DisplayName("Missing and changed dimensions name the first offending key in sorted order")
    void testDimensionVerdicts() {
        CacheSignature cache = CacheSignature.of("core", Map.of("device", "d1", "region", "r1"));
        CacheSignature query = CacheSignature.of("core", Map.of("region", "r2", "device", "d2", "channel", "c1"));

        SignatureMatch missing = matcher.canSatisfy(cache, query);
        assertEquals(SignatureMatch.Verdict.MISSING_DIMENSION, missing.verdict());
        assertEquals("MISSING_DIMENSION(channel)", missing.describe());

        CacheSignature changedQuery = CacheSignature.of("core", Map.of("region", "r2", "device", "d2"));
        SignatureMatch changed = matcher.canSatisfy(cache, changedQuery);
        assertEquals(SignatureMatch.dimensionDefinitionChanged("device"), changed);
    }

    @Test
    @DisplayName("Unparseable signatures are incompatible even with themselves")
    void testUnparseable() {
        CacheSignature sentinel = CacheSignature.unparseable();

        assertEquals(SignatureMatch.Verdict.UNPARSEABLE_SIGNATURE, matcher.canSatisfy(sentinel, sentinel).verdict());
        assertEquals(SignatureMatch.Verdict.UNPARSEABLE_SIGNATURE,
                matcher.canSatisfy(CacheSignature.of("core"), sentinel).verdict());
        assertTrue(matcher.unspecifiedDimensions(sentinel, CacheSignature.of("core")).isEmpty());
    }

    @Test
    @DisplayName("Core hash ignores set ordering but changes with identity inputs")
    void testCoreHash() {
        String first = new CoreHashBuilder()
                .connection("warehouse")
                .fromEvent("view")
                .toEvent("purchase")
                .visited(List.of("cart", "checkout"))
                .eventDefinition("purchase", "def-1")
                .build();
        String reordered = new CoreHashBuilder()
                .connection("warehouse")
                .fromEvent("view")
                .toEvent("purchase")
                .visited(List.of("checkout", "cart"))
                .eventDefinition("purchase", "def-1")
                .build();
        String redefined = new CoreHashBuilder()
                .connection("warehouse")
                .fromEvent("view")
                .toEvent("purchase")
                .visited(List.of("cart", "checkout"))
                .eventDefinition("purchase", "def-2")
                .build();

        assertEquals(first, reordered);
        assertNotEquals(first, redefined);
        assertThrows(IllegalStateException.class, () -> new CoreHashBuilder().fromEvent("view").build());
    }
}
