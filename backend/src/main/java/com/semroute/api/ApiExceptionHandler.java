/*
 * Copyright (C) 2025 Semroute
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.semroute.api;

import com.semroute.application.DuplicateProviderException;
import com.semroute.application.UnknownCapabilityException;
import com.semroute.application.circuit.CircuitOpenException;
import com.semroute.application.routing.AllProvidersFailedException;
import com.semroute.application.routing.RoutingCancelledException;
import com.semroute.config.RequestIdFilter;
import com.semroute.domain.model.ProviderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.LinkedHashMap;
import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ApiErrorResponse> handleApi(ApiException ex) {
        return respond(ex.getStatus(), ex.getStatus().name(), ex.getMessage(), null);
    }

    /**
     * Every provider was tried (or skipped) and none answered. The attempt log goes back to the
     * caller so the failure is never opaque.
     */
    @ExceptionHandler(AllProvidersFailedException.class)
    public ResponseEntity<ApiErrorResponse> handleAllFailed(AllProvidersFailedException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("capability", ex.capability().pathName());
        details.put("attempts", ex.attempts());
        details.put("excluded", ex.excluded().stream().map(ProviderId::name).toList());
        if (ex.stopReason() != null) details.put("stopReason", ex.stopReason());
        return respond(HttpStatus.BAD_GATEWAY, ex.code(), ex.getMessage(), details);
    }

    @ExceptionHandler(RoutingCancelledException.class)
    public ResponseEntity<ApiErrorResponse> handleCancelled(RoutingCancelledException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("capability", ex.capability().pathName());
        details.put("attempts", ex.attempts());
        details.put("reason", ex.reason());
        return respond(HttpStatus.GATEWAY_TIMEOUT, ex.code(), ex.getMessage(), details);
    }

    @ExceptionHandler(UnknownCapabilityException.class)
    public ResponseEntity<ApiErrorResponse> handleUnknownCapability(UnknownCapabilityException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.code(), ex.getMessage(), null);
    }

    @ExceptionHandler(CircuitOpenException.class)
    public ResponseEntity<ApiErrorResponse> handleCircuitOpen(CircuitOpenException ex) {
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ex.code(), ex.getMessage(), null);
    }

    @ExceptionHandler(DuplicateProviderException.class)
    public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateProviderException ex) {
        return respond(HttpStatus.CONFLICT, ex.code(), ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiErrorResponse> handleBadRequest(IllegalArgumentException ex) {
        return respond(HttpStatus.BAD_REQUEST, "BAD_REQUEST", ex.getMessage(), null);
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingRequestHeaderException.class,
            HandlerMethodValidationException.class
    })
    public ResponseEntity<ApiErrorResponse> handleMalformed(Exception ex) {
        return respond(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Invalid request", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleAny(Exception ex) {
        String requestId = currentRequestId();
        log.error("Unhandled exception requestId={}", requestId, ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "UNEXPECTED_ERROR", "Unexpected error", null);
    }

    private ResponseEntity<ApiErrorResponse> respond(HttpStatus status, String code, String message, Object details) {
        if (status.is5xxServerError() && status != HttpStatus.INTERNAL_SERVER_ERROR) {
            log.warn("Routing failure requestId={} status={} code={} message={}", currentRequestId(), status.value(), code, message);
        }
        ApiErrorResponse body = new ApiErrorResponse(
                status.name(),
                code,
                message,
                currentRequestId(),
                details
        );
        return ResponseEntity.status(status).body(body);
    }

    private String currentRequestId() {
        String rid = MDC.get(RequestIdFilter.MDC_KEY);
        return (rid == null || rid.isBlank()) ? "" : rid;
    }
}
