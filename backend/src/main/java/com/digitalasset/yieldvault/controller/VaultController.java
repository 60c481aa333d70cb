// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.DepositRequest;
import com.digitalasset.yieldvault.dto.DepositResponse;
import com.digitalasset.yieldvault.dto.PositionResponse;
import com.digitalasset.yieldvault.dto.VaultSummaryResponse;
import com.digitalasset.yieldvault.dto.WithdrawRequest;
import com.digitalasset.yieldvault.dto.WithdrawResponse;
import com.digitalasset.yieldvault.service.VaultService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/vault")
public class VaultController {

    private final VaultService vaultService;

    public VaultController(final VaultService vaultService) {
        this.vaultService = vaultService;
    }

    /**
     * POST /api/vault/deposit
     */
    @PostMapping("/deposit")
    @WithSpan
    public ResponseEntity<?> deposit(@Valid @RequestBody DepositRequest request) {
        Result<DepositResponse, DomainError> result = vaultService.deposit(request);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.errorResponse(result.getErrorUnsafe(), "/api/vault/deposit");
    }

    /**
     * POST /api/vault/withdraw
     */
    @PostMapping("/withdraw")
    @WithSpan
    public ResponseEntity<?> withdraw(@Valid @RequestBody WithdrawRequest request) {
        Result<WithdrawResponse, DomainError> result = vaultService.withdraw(request);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.errorResponse(result.getErrorUnsafe(), "/api/vault/withdraw");
    }

    @GetMapping("/summary")
    @WithSpan
    public ResponseEntity<VaultSummaryResponse> summary() {
        return ResponseEntity.ok(vaultService.summary());
    }

    @GetMapping("/positions/{holder}")
    @WithSpan
    public ResponseEntity<?> position(@PathVariable("holder") String holder) {
        Result<PositionResponse, DomainError> result = vaultService.position(holder);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.errorResponse(result.getErrorUnsafe(), "/api/vault/positions/{holder}");
    }
}
