package com.finbrain.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
