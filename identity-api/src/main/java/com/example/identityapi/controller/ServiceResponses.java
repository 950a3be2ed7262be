package com.example.identityapi.controller;

import com.example.identityapi.dto.ErrorResponse;
import com.example.identityapi.service.result.ServiceResult;
import org.springframework.http.ResponseEntity;

/**
 * Maps service results to HTTP responses.
 * Failures use the status carried by their {@link com.example.identityapi.service.result.ServiceError}.
 */
final class ServiceResponses {

    private ServiceResponses() {
    }

    static ResponseEntity<?> noContent(ServiceResult<Void> result) {
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.noContent().build();
    }

    static ResponseEntity<?> ok(ServiceResult<?> result) {
        if (!result.isSuccess()) {
            return failure(result);
        }
        return ResponseEntity.ok(result.value());
    }

    static ResponseEntity<ErrorResponse> failure(ServiceResult<?> result) {
        int status = result.error().getStatus().value();
        return ResponseEntity.status(status).body(ErrorResponse.of(status, result.errors()));
    }
}
