package com.nosota.landmarket.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Error body returned by {@code GlobalExceptionHandler}.
 *
 * @param timestamp When the error was produced
 * @param status    HTTP status code
 * @param error     Short title
 * @param message   Human readable message
 * @param path      Request URI
 * @param details   Machine readable extras (required amount, remaining cooldown), omitted when empty
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
        LocalDateTime timestamp,
        int status,
        String error,
        String message,
        String path,
        Map<String, Object> details
) {

    public static ErrorResponse of(int status, String error, String message, String path) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, Map.of());
    }

    public static ErrorResponse of(int status, String error, String message, String path, Map<String, Object> details) {
        return new ErrorResponse(LocalDateTime.now(), status, error, message, path, details);
    }
}
