package com.finbrain.infrastructure.ai.cache;

import com.finbrain.domain.inference.model.InferenceMode;
import com.finbrain.infrastructure.ai.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeyBuilderTest {

    private CacheKeyBuilder keyBuilder;

    @BeforeEach
    void setUp() {
        keyBuilder = new CacheKeyBuilder(new TextNormalizer());
    }

    @Test
    @DisplayName("Same input always yields the same key")
    void deterministic() {
        String first = keyBuilder.buildKey(InferenceMode.PARSE, "STARBUCKS #1234 SEATTLE");
        String second = new CacheKeyBuilder(new TextNormalizer()).buildKey(InferenceMode.PARSE, "STARBUCKS #1234 SEATTLE");

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Known digest of the versioned input")
    void knownDigest() {
        // sha256("v1|PARSE|abc")
        assertThat(keyBuilder.buildKey(InferenceMode.PARSE, "abc"))
                .isEqualTo("607d267e72992762676d0f6e1050f5d44af55d2ff4e6cef102422bfd6485d820");
    }

    @Test
    @DisplayName("Keys are fixed-length lowercase hex")
    void fixedLength() {
        assertThat(keyBuilder.buildKey(InferenceMode.ANALYZE, "x")).hasSize(64).matches("[0-9a-f]{64}");
        assertThat(keyBuilder.buildKey(InferenceMode.ANALYZE, "x".repeat(5000))).hasSize(64);
    }

    @Test
    @DisplayName("Whitespace and case variants share a key")
    void normalized() {
        assertThat(keyBuilder.buildKey(InferenceMode.PARSE, "  Whole   Foods "))
                .isEqualTo(keyBuilder.buildKey(InferenceMode.PARSE, "whole foods"));
    }

    @Test
    @DisplayName("Modes never share a key")
    void modeSeparation() {
        assertThat(keyBuilder.buildKey(InferenceMode.PARSE, "coffee"))
                .isNotEqualTo(keyBuilder.buildKey(InferenceMode.ANALYZE, "coffee"));
    }
}
