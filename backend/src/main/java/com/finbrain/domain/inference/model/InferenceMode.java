package com.finbrain.domain.inference.model;

/**
 * Operating modes of the remote AI Brain.
 * <p>
 * PARSE answers are structured ({@code [{label, category}]}); CHAT and ANALYZE answers are free text.
 * CHAT answers depend on conversation state and are never cached.
 */
public enum InferenceMode {
    CHAT("chat", false, false),
    ANALYZE("analyze", false, true),
    PARSE("parse", true, true);

    private final String wireName;
    private final boolean structured;
    private final boolean cacheable;

    InferenceMode(String wireName, boolean structured, boolean cacheable) {
        this.wireName = wireName;
        this.structured = structured;
        this.cacheable = cacheable;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isStructured() {
        return structured;
    }

    public boolean isCacheable() {
        return cacheable;
    }

    public static InferenceMode fromWireName(String value) {
        for (InferenceMode mode : values()) {
            if (mode.wireName.equalsIgnoreCase(value)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown inference mode: " + value);
    }
}
