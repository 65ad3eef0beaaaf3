package com.finbrain.domain.inference.service;

import com.finbrain.domain.inference.model.FastPrediction;

/**
 * Local statistical classifier used for the fast path. Synchronous, no network, expected to complete in
 * low single-digit milliseconds.
 */
public interface FastClassifier {

    FastPrediction classify(String text);
}
