package io.mcg.engine.provenance;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Map;
import java.util.UUID;

/**
 * Content addressing and identifier generation.
 *
 * <p>Asset ids are {@code prefix(kind) + first6(sha256(canonical_json(payload)))}. Canonical JSON
 * sorts map keys at every depth, so two payloads that are deeply equal hash the same regardless
 * of insertion order.
 */
public final class AssetIds {
    private static final ObjectWriter CANONICAL = new ObjectMapper()
        .writer()
        .with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    private static final int ID_HASH_LENGTH = 6;

    private AssetIds() {}

    public static String assetId(AssetKind kind, Map<String, Object> payload) {
        return kind.prefix() + sha256Hex(canonicalJson(payload)).substring(0, ID_HASH_LENGTH);
    }

    public static String runId() {
        return "run_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    public static String canonicalJson(Object value) {
        try {
            return CANONICAL.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Payload is not serializable: " + ex.getOriginalMessage(), ex);
        }
    }

    public static String sha256Hex(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(hashed.length * 2);
            for (byte b : hashed) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 algorithm unavailable", ex);
        }
    }
}
