// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.service;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.ManagerSwapRequest;
import com.digitalasset.yieldvault.dto.ManagerSwapResponse;
import com.digitalasset.yieldvault.dto.ReserveDTO;
import com.digitalasset.yieldvault.dto.ReservesResponse;
import com.digitalasset.yieldvault.metrics.VaultMetrics;
import com.digitalasset.yieldvault.strategy.MultiAssetStrategy;
import com.digitalasset.yieldvault.util.Amounts;
import com.digitalasset.yieldvault.validation.RequestValidator;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class StrategyService {

    private static final Logger LOG = LoggerFactory.getLogger(StrategyService.class);

    private final MultiAssetStrategy strategy;
    private final ChainState chain;
    private final RequestValidator validator;
    private final VaultMetrics metrics;

    public StrategyService(
            final MultiAssetStrategy strategy,
            final ChainState chain,
            final RequestValidator validator,
            final VaultMetrics metrics
    ) {
        this.strategy = strategy;
        this.chain = chain;
        this.validator = validator;
        this.metrics = metrics;
    }

    /**
     * Reserve ledger with settlement values, read in one serialized call so the entries and the
     * total are consistent.
     */
    @WithSpan
    public ReservesResponse reserves() {
        return chain.read(() -> {
            List<ReserveDTO> entries = new ArrayList<>();
            for (Map.Entry<Asset, BigInteger> entry : strategy.reserveSnapshot().entrySet()) {
                Asset asset = entry.getKey();
                entries.add(new ReserveDTO(
                        asset.symbol(),
                        asset.address().value(),
                        Amounts.format(entry.getValue()),
                        Amounts.format(strategy.assetValue(asset, entry.getValue()))));
            }
            return new ReservesResponse(
                    strategy.address().value(),
                    strategy.settlementAsset().symbol(),
                    Amounts.format(strategy.totalAssets()),
                    entries);
        });
    }

    @WithSpan
    public Result<ManagerSwapResponse, DomainError> swap(final ManagerSwapRequest request) {
        Result<ManagerSwapResponse, DomainError> result = executeSwap(request);
        if (result.isOk()) {
            metrics.recordSwap(result.getValueUnsafe().tokenIn, result.getValueUnsafe().tokenOut);
            LOG.info("Manager swap {} {} -> {} {}", request.amountIn, request.tokenIn,
                    result.getValueUnsafe().amountOut, request.tokenOut);
        } else {
            DomainError error = result.getErrorUnsafe();
            metrics.recordFailure("invokeSwap", error.code());
            LOG.warn("invokeSwap rejected for {}: {}", request.caller, error);
        }
        return result;
    }

    private Result<ManagerSwapResponse, DomainError> executeSwap(final ManagerSwapRequest request) {
        Result<Address, DomainError> caller = validator.address(request.caller, "caller");
        if (caller.isErr()) {
            return Result.err(caller.getErrorUnsafe());
        }
        Result<Address, DomainError> swapper = validator.address(request.swapper, "swapper");
        if (swapper.isErr()) {
            return Result.err(swapper.getErrorUnsafe());
        }
        Result<Asset, DomainError> tokenIn = validator.asset(request.tokenIn, "tokenIn");
        if (tokenIn.isErr()) {
            return Result.err(tokenIn.getErrorUnsafe());
        }
        Result<Asset, DomainError> tokenOut = validator.asset(request.tokenOut, "tokenOut");
        if (tokenOut.isErr()) {
            return Result.err(tokenOut.getErrorUnsafe());
        }
        Result<BigInteger, DomainError> amountIn = validator.amount(request.amountIn, "amountIn");
        if (amountIn.isErr()) {
            return Result.err(amountIn.getErrorUnsafe());
        }
        Result<BigInteger, DomainError> minAmountOut = validator.amount(request.minAmountOut, "minAmountOut");
        if (minAmountOut.isErr()) {
            return Result.err(minAmountOut.getErrorUnsafe());
        }

        return Result.capture(() -> strategy.invokeSwap(
                        caller.getValueUnsafe(),
                        swapper.getValueUnsafe(),
                        tokenIn.getValueUnsafe(),
                        amountIn.getValueUnsafe(),
                        tokenOut.getValueUnsafe(),
                        minAmountOut.getValueUnsafe()))
                .map(amountOut -> new ManagerSwapResponse(
                        swapper.getValueUnsafe().value(),
                        tokenIn.getValueUnsafe().symbol(),
                        Amounts.format(amountIn.getValueUnsafe()),
                        tokenOut.getValueUnsafe().symbol(),
                        Amounts.format(amountOut)));
    }
}
