package com.finbrain.application.feedback;

import java.util.Map;

/**
 * @param consensus merchant key to agreed category, for merchants that reached consensus
 */
public record FeedbackStats(
        long totalCorrections,
        long ignoredCorrections,
        int merchantsCorrected,
        int pendingConsensus,
        Map<String, String> consensus
) {
}
