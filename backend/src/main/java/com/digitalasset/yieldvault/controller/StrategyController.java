// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.ManagerSwapRequest;
import com.digitalasset.yieldvault.dto.ManagerSwapResponse;
import com.digitalasset.yieldvault.dto.ReservesResponse;
import com.digitalasset.yieldvault.service.StrategyService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/strategy")
public class StrategyController {

    private final StrategyService strategyService;

    public StrategyController(final StrategyService strategyService) {
        this.strategyService = strategyService;
    }

    @GetMapping("/reserves")
    @WithSpan
    public ResponseEntity<ReservesResponse> reserves() {
        return ResponseEntity.ok(strategyService.reserves());
    }

    /**
     * POST /api/strategy/swap (manager only)
     */
    @PostMapping("/swap")
    @WithSpan
    public ResponseEntity<?> swap(@Valid @RequestBody ManagerSwapRequest request) {
        Result<ManagerSwapResponse, DomainError> result = strategyService.swap(request);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.errorResponse(result.getErrorUnsafe(), "/api/strategy/swap");
    }
}
