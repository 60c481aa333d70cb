// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.errors.ComeBackLaterError;
import com.digitalasset.yieldvault.common.errors.FailedToSendEthError;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;
import com.digitalasset.yieldvault.common.errors.ReentrantCallError;
import com.digitalasset.yieldvault.common.errors.UnauthorizedError;
import com.digitalasset.yieldvault.common.errors.ValidationError;
import com.digitalasset.yieldvault.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Centralizes DomainError -> HttpStatus mapping so all controllers respond consistently.
 */
final class DomainErrorStatusMapper {

    private DomainErrorStatusMapper() {
    }

    static HttpStatus map(final DomainError error) {
        if (error instanceof ValidationError validationError) {
            return validationError.type() == ValidationError.Type.CONFIGURATION
                    ? HttpStatus.UNPROCESSABLE_ENTITY
                    : HttpStatus.BAD_REQUEST;
        }
        if (error instanceof UnauthorizedError) {
            return HttpStatus.FORBIDDEN;
        }
        if (error instanceof ComeBackLaterError) {
            return HttpStatus.LOCKED;
        }
        if (error instanceof InsufficientBalanceError
                || error instanceof FailedToSendEthError
                || error instanceof ReentrantCallError) {
            return HttpStatus.CONFLICT;
        }
        HttpStatus derived = HttpStatus.resolve(error.httpStatus());
        return derived != null ? derived : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<ErrorResponse> errorResponse(final DomainError error, final String path) {
        HttpStatus status = map(error);
        ErrorResponse payload = new ErrorResponse(error.code(), error.message(), status.value(), path);
        if (error instanceof ComeBackLaterError locked) {
            payload.setDetails(Map.of("lockedUntil", locked.lockedUntil().toString()));
        }
        return ResponseEntity.status(status).body(payload);
    }
}
