package com.govsync.contract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 over the canonical form of a request: object keys sorted at every depth,
 * compact output. Identical content always yields the identical fingerprint.
 */
@Component
public class PayloadFingerprinter {

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .disable(SerializationFeature.INDENT_OUTPUT)
        .build();

    public String fingerprint(JsonNode payload) {
        return sha256(canonicalize(payload));
    }

    String canonicalize(JsonNode payload) {
        if (payload == null || payload.isMissingNode()) {
            return "null";
        }
        try {
            // ObjectNode keeps insertion order; going through Map applies the key ordering
            Object plain = canonicalMapper.convertValue(payload, Object.class);
            return canonicalMapper.writeValueAsString(plain);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("payload is not serializable", ex);
        }
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
