package com.finbrain.infrastructure.ai.brain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.finbrain.domain.inference.model.InferenceMode;

/**
 * Response envelope of {@code POST /query}.
 *
 * @param mode             mode the remote service answered in
 * @param response         free-text answer
 * @param parsedData       structured answer for PARSE (nullable)
 * @param confidence       remote self-reported confidence in [0,1] (nullable)
 * @param processingTimeMs remote processing time (nullable)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BrainReply(
        String mode,
        String response,
        @JsonProperty("parsed_data") JsonNode parsedData,
        Double confidence,
        @JsonProperty("processing_time_ms") Double processingTimeMs
) {

    /**
     * Raw text to validate for the given mode. For PARSE the structured payload wins over free text;
     * a single parsed transaction is wrapped into a one-element array.
     */
    public String payloadFor(InferenceMode mode) {
        if (!mode.isStructured() || parsedData == null || parsedData.isNull()) {
            return response;
        }
        if (parsedData.isArray() || parsedData.has("items")) {
            return parsedData.toString();
        }
        if (parsedData.isObject() && parsedData.has("category")) {
            ObjectNode entry = JsonNodeFactory.instance.objectNode();
            JsonNode label = parsedData.hasNonNull("label") ? parsedData.get("label") : parsedData.get("merchant");
            entry.set("label", label);
            entry.set("category", parsedData.get("category"));
            ArrayNode wrapped = JsonNodeFactory.instance.arrayNode();
            wrapped.add(entry);
            return wrapped.toString();
        }
        return response;
    }
}
