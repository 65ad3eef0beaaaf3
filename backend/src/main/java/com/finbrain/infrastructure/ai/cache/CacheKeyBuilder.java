package com.finbrain.infrastructure.ai.cache;

import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Builds deterministic, fixed-length SHA-256 cache keys from the mode and normalized query.
 * The digest input is versioned so that a format change never reads stale entries.
 */
@Component
@RequiredArgsConstructor
public class CacheKeyBuilder {

    static final String KEY_VERSION = "v1";

    private final TextNormalizer normalizer;

    /**
     * @return hex-encoded SHA-256 of {@code v1|MODE|normalized query}
     */
    public String buildKey(InferenceMode mode, String query) {
        String raw = KEY_VERSION + "|" + mode.name() + "|" + normalizer.canonicalKey(query);
        return sha256(raw);
    }

    private String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
