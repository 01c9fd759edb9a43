package com.factguard.interfaces.api.dto;

public record ErrorResponse(String code, String message) {}
