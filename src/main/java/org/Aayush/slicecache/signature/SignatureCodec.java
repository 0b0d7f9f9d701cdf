package org.Aayush.slicecache.signature;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Iterator;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON codec for {@link CacheSignature}.
 *
 * <p>Wire form: {@code {"c":"<core>","x":{"<key>":"<hash>"}}} with keys sorted. Parsing is
 * defensive and never throws: anything that is not a well-formed structured signature becomes
 * the unparseable sentinel.</p>
 */
public final class SignatureCodec {
    static final String FIELD_CORE = "c";
    static final String FIELD_DIMENSIONS = "x";

    private final ObjectMapper mapper;

    public SignatureCodec() {
        this(new ObjectMapper());
    }

    public SignatureCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /**
     * Serialises a structured signature.
     *
     * @throws IllegalArgumentException for the unparseable sentinel, which has no wire form.
     */
    public String serialize(CacheSignature signature) {
        if (signature.isUnparseable()) {
            throw new IllegalArgumentException("unparseable sentinel cannot be serialised");
        }
        ObjectNode root = mapper.createObjectNode();
        root.put(FIELD_CORE, signature.coreHash());
        ObjectNode dims = root.putObject(FIELD_DIMENSIONS);
        for (Map.Entry<String, String> entry : signature.dimensionHashes().entrySet()) {
            dims.put(entry.getKey(), entry.getValue());
        }
        try {
            return mapper.writeValueAsString(root);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialise signature", ex);
        }
    }

    /**
     * Parses a stored signature string.
     *
     * <p>Null, blank, legacy plain-hash, non-JSON, non-object, or a missing/blank/non-string core
     * hash all yield the sentinel. A missing or null {@code x} yields no dimension hashes;
     * non-string dimension entries are dropped.</p>
     */
    public CacheSignature parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return CacheSignature.unparseable();
        }
        JsonNode root;
        try {
            root = mapper.readTree(raw);
        } catch (JsonProcessingException ex) {
            return CacheSignature.unparseable();
        }
        if (root == null || !root.isObject()) {
            return CacheSignature.unparseable();
        }
        JsonNode core = root.get(FIELD_CORE);
        if (core == null || !core.isTextual() || core.asText().isBlank()) {
            return CacheSignature.unparseable();
        }
        JsonNode dims = root.get(FIELD_DIMENSIONS);
        TreeMap<String, String> hashes = new TreeMap<>();
        if (dims != null && !dims.isNull()) {
            if (!dims.isObject()) {
                return CacheSignature.unparseable();
            }
            Iterator<Map.Entry<String, JsonNode>> fields = dims.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isTextual() && !field.getKey().isBlank()) {
                    hashes.put(field.getKey(), field.getValue().asText());
                }
            }
        }
        return CacheSignature.of(core.asText(), hashes);
    }
}
