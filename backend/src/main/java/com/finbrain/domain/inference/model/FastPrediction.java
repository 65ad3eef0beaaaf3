package com.finbrain.domain.inference.model;

/**
 * Output of the local fast-path classifier. {@code probability} is null when the classifier
 * cannot estimate one.
 */
public record FastPrediction(String category, Double probability) {
}
