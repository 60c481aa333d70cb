// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.config;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for all REST controllers.
 *
 * Provides standardized error responses across all endpoints:
 * - Domain exceptions that escaped a service (status from the error itself)
 * - Validation errors and unreadable bodies (400 Bad Request)
 * - Generic exceptions (500 Internal Server Error)
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DomainException.class)
    public ResponseEntity<ErrorResponse> handleDomainException(
            DomainException ex,
            HttpServletRequest request
    ) {
        DomainError error = ex.error();
        HttpStatus status = HttpStatus.resolve(error.httpStatus());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        ErrorResponse errorResponse = withRequestId(
            new ErrorResponse(error.code(), error.message(), status.value(), request.getRequestURI()),
            request);

        logger.warn("DomainException: {} {} - {}", status.value(), request.getRequestURI(), error);

        return ResponseEntity.status(status).body(errorResponse);
    }

    /**
     * Handle validation errors (e.g., @Valid annotation failures).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(
            MethodArgumentNotValidException ex,
            HttpServletRequest request
    ) {
        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
            validationErrors.put(error.getField(), error.getDefaultMessage())
        );

        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "VALIDATION_ERROR",
            "Request validation failed",
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        ), request);
        errorResponse.setDetails(validationErrors);

        logger.warn("Validation error on {}: {}", request.getRequestURI(), validationErrors);

        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(
            HttpMessageNotReadableException ex,
            HttpServletRequest request
    ) {
        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "VALIDATION_ERROR",
            "Request body is missing or malformed",
            HttpStatus.BAD_REQUEST.value(),
            request.getRequestURI()
        ), request);

        logger.warn("Unreadable body on {}: {}", request.getRequestURI(), ex.getMessage());

        return ResponseEntity.badRequest().body(errorResponse);
    }

    /**
     * Handle all other uncaught exceptions.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex,
            HttpServletRequest request
    ) {
        ErrorResponse errorResponse = withRequestId(new ErrorResponse(
            "INTERNAL_SERVER_ERROR",
            ex.getMessage() != null ? ex.getMessage() : "An unexpected error occurred",
            HttpStatus.INTERNAL_SERVER_ERROR.value(),
            request.getRequestURI()
        ), request);

        logger.error("Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private ErrorResponse withRequestId(ErrorResponse errorResponse, HttpServletRequest request) {
        String requestId = request.getHeader("X-Request-ID");
        if (requestId != null) {
            errorResponse.setRequestId(requestId);
        }
        return errorResponse;
    }
}
