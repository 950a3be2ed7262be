package com.example.identityapi.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Standard error response DTO.
 *
 * errors: every business failure message of the operation
 * fieldErrors: bean validation failures keyed by field
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int status,
        String message,
        LocalDateTime timestamp,
        List<String> errors,
        Map<String, String> fieldErrors
) {
    public static ErrorResponse of(int status, String message) {
        return new ErrorResponse(status, message, LocalDateTime.now(), null, null);
    }

    public static ErrorResponse of(int status, List<String> errors) {
        String message = errors.isEmpty() ? null : errors.get(0);
        return new ErrorResponse(status, message, LocalDateTime.now(), errors, null);
    }

    public static ErrorResponse ofFields(int status, String message, Map<String, String> fieldErrors) {
        return new ErrorResponse(status, message, LocalDateTime.now(), null, fieldErrors);
    }
}
