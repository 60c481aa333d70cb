// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.service;

import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.BackstopSwapRequest;
import com.digitalasset.yieldvault.dto.BackstopSwapResponse;
import com.digitalasset.yieldvault.metrics.VaultMetrics;
import com.digitalasset.yieldvault.util.Amounts;
import com.digitalasset.yieldvault.validation.RequestValidator;
import com.digitalasset.yieldvault.vault.SingleAssetVault;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Native-coin to held-asset swaps against the single-asset vault.
 */
@Service
public class BackstopService {

    private static final Logger LOG = LoggerFactory.getLogger(BackstopService.class);

    private final SingleAssetVault backstop;
    private final RequestValidator validator;
    private final VaultMetrics metrics;

    public BackstopService(final SingleAssetVault backstop, final RequestValidator validator, final VaultMetrics metrics) {
        this.backstop = backstop;
        this.validator = validator;
        this.metrics = metrics;
    }

    @WithSpan
    public Result<BackstopSwapResponse, DomainError> swapNative(final BackstopSwapRequest request) {
        Result<BackstopSwapResponse, DomainError> result = validator.address(request.caller, "caller")
                .flatMap(caller -> validator.amount(request.amount, "amount")
                        .flatMap(amount -> Result.capture(() -> backstop.swapNativeForAsset(caller, amount))
                                .map(out -> new BackstopSwapResponse(
                                        caller.value(),
                                        Amounts.format(amount),
                                        backstop.asset().symbol(),
                                        Amounts.format(out),
                                        Amounts.format(backstop.assetReserve())))));
        if (result.isOk()) {
            metrics.recordBackstopSwap();
            LOG.info("Backstop swap by {}: {} native", request.caller, request.amount);
        } else {
            DomainError error = result.getErrorUnsafe();
            metrics.recordFailure("swapNativeForAsset", error.code());
            LOG.warn("swapNativeForAsset rejected for {}: {}", request.caller, error);
        }
        return result;
    }
}
