package com.finbrain.domain.inference.model;

public enum CategorizationSource {
    /** Local classifier answer accepted by the confidence policy. */
    FAST_PATH,
    /** Remote AI Brain answer. */
    SMART_PATH,
    /** Local classifier guess returned because the smart path degraded. */
    FAST_PATH_FALLBACK
}
