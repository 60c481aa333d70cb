// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.controller;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.BackstopSwapRequest;
import com.digitalasset.yieldvault.dto.BackstopSwapResponse;
import com.digitalasset.yieldvault.service.BackstopService;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/backstop")
public class BackstopController {

    private final BackstopService backstopService;

    public BackstopController(final BackstopService backstopService) {
        this.backstopService = backstopService;
    }

    @PostMapping("/swap-native")
    @WithSpan
    public ResponseEntity<?> swapNative(@Valid @RequestBody BackstopSwapRequest request) {
        Result<BackstopSwapResponse, DomainError> result = backstopService.swapNative(request);
        if (result.isOk()) {
            return ResponseEntity.ok(result.getValueUnsafe());
        }
        return DomainErrorStatusMapper.errorResponse(result.getErrorUnsafe(), "/api/backstop/swap-native");
    }
}
