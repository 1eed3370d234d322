package com.signalsync.cloud.dto;

public record ErrorResponse(String code, String message) {
}
