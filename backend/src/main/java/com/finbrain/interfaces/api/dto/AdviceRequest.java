package com.finbrain.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

public record AdviceRequest(
        @NotBlank(message = "Query is required")
        @Size(max = 2000, message = "Query must not exceed 2000 characters")
        String query,

        Map<String, Object> context
) {}
