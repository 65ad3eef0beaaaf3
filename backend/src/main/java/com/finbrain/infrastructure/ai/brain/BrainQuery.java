package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Request body of {@code POST /query}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BrainQuery(
        String query,
        String mode,
        Map<String, Object> context,
        @JsonProperty("conversation_history") List<Map<String, String>> conversationHistory
) {
}
