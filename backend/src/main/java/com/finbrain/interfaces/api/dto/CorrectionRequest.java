package com.finbrain.interfaces.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CorrectionRequest(
        String originalCategory,

        @NotBlank(message = "Corrected category is required")
        String correctedCategory,

        @NotBlank(message = "Description is required")
        @Size(max = 500, message = "Description must not exceed 500 characters")
        String description
) {}
