package com.finbrain.domain.inference.service;

/**
 * Receives user corrections for a retraining collaborator. Fire-and-forget: implementations must not
 * block the caller or propagate failures.
 */
public interface FeedbackHook {

    void recordCorrection(String originalCategory, String correctedCategory, String description);
}
