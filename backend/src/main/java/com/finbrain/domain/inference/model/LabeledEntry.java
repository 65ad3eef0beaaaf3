package com.finbrain.domain.inference.model;

/**
 * One labeled transaction from a PARSE answer.
 */
public record LabeledEntry(String label, String category) {
}
