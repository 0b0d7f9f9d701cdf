package org.Aayush.slicecache.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * SHA-256 fingerprints over canonical JSON.
 *
 * <p>Map entries are written in key order so logically equal inputs always hash equally.</p>
 */
public final class CanonicalHashing {
    private static final ObjectMapper CANONICAL_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);

    private CanonicalHashing() {
        throw new AssertionError("Utility class - do not instantiate");
    }

    /**
     * Serialises {@code value} as canonical JSON.
     */
    public static String canonicalJson(Object value) {
        try {
            return CANONICAL_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("value is not JSON-serialisable: " + ex.getOriginalMessage(), ex);
        }
    }

    /**
     * Returns lower-case hex SHA-256 of the canonical JSON form of {@code value}.
     */
    public static String sha256Hex(Object value) {
        return sha256Hex(canonicalJson(value));
    }

    /**
     * Returns lower-case hex SHA-256 of a UTF-8 string.
     */
    public static String sha256Hex(String text) {
        byte[] digest = sha256().digest(text.getBytes(StandardCharsets.UTF_8));
        StringBuilder hex = new StringBuilder(digest.length * 2);
        for (byte b : digest) {
            hex.append(Character.forDigit((b >> 4) & 0xF, 16)).append(Character.forDigit(b & 0xF, 16));
        }
        return hex.toString();
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 unavailable", ex);
        }
    }
}
