// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.service;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.dto.DepositRequest;
import com.digitalasset.yieldvault.dto.DepositResponse;
import com.digitalasset.yieldvault.dto.PositionResponse;
import com.digitalasset.yieldvault.dto.VaultSummaryResponse;
import com.digitalasset.yieldvault.dto.WithdrawRequest;
import com.digitalasset.yieldvault.dto.WithdrawResponse;
import com.digitalasset.yieldvault.metrics.VaultMetrics;
import com.digitalasset.yieldvault.strategy.Strategy;
import com.digitalasset.yieldvault.strategy.WithdrawalReceipt;
import com.digitalasset.yieldvault.util.Amounts;
import com.digitalasset.yieldvault.validation.RequestValidator;
import com.digitalasset.yieldvault.vault.DepositReceipt;
import com.digitalasset.yieldvault.vault.MultiAssetVault;
import io.opentelemetry.instrumentation.annotations.WithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.Instant;
import java.util.Optional;

/**
 * Deposit, withdrawal and position reads against the multi-asset vault.
 */
@Service
public class VaultService {

    private static final Logger LOG = LoggerFactory.getLogger(VaultService.class);

    private final MultiAssetVault vault;
    private final RequestValidator validator;
    private final VaultMetrics metrics;

    public VaultService(final MultiAssetVault vault, final RequestValidator validator, final VaultMetrics metrics) {
        this.vault = vault;
        this.validator = validator;
        this.metrics = metrics;
    }

    @WithSpan
    public Result<DepositResponse, DomainError> deposit(final DepositRequest request) {
        Result<DepositResponse, DomainError> result = validator.address(request.holder, "holder")
                .flatMap(holder -> validator.asset(request.asset, "asset")
                        .flatMap(asset -> validator.amount(request.amount, "amount")
                                .flatMap(amount -> Result.capture(
                                        () -> vault.deposit(holder, asset, amount, request.sellForSettlement)))))
                .map(this::toResponse);
        if (result.isOk()) {
            metrics.recordDeposit(result.getValueUnsafe().asset);
            refreshGauges();
            LOG.info("Deposit by {}: {} {} -> {} shares", request.holder, request.amount, request.asset,
                    result.getValueUnsafe().sharesMinted);
        } else {
            reject("deposit", request.holder, result.getErrorUnsafe());
        }
        return result;
    }

    @WithSpan
    public Result<WithdrawResponse, DomainError> withdraw(final WithdrawRequest request) {
        Result<WithdrawResponse, DomainError> result = validator.address(request.holder, "holder")
                .flatMap(holder -> validator.amount(request.shares, "shares")
                        .flatMap(shares -> Result.capture(() -> vault.withdraw(holder, shares))
                                .map(receipt -> toResponse(receipt, shares))));
        if (result.isOk()) {
            metrics.recordWithdrawal();
            refreshGauges();
            LOG.info("Withdrawal by {}: {} shares -> settlement={}, native={}", request.holder, request.shares,
                    result.getValueUnsafe().settlementOut, result.getValueUnsafe().nativeOut);
        } else {
            reject("withdraw", request.holder, result.getErrorUnsafe());
        }
        return result;
    }

    @WithSpan
    public VaultSummaryResponse summary() {
        VaultSummaryResponse summary = new VaultSummaryResponse();
        summary.vault = vault.address().value();
        Optional<Strategy> strategy = vault.strategy();
        summary.strategy = strategy.map(s -> s.address().value()).orElse(null);
        summary.settlementAsset = strategy.map(s -> s.settlementAsset().symbol()).orElse(null);
        summary.totalAssets = Amounts.format(vault.totalAssets());
        summary.totalSupply = Amounts.format(vault.totalSupply());
        summary.sharePrice = Amounts.format(vault.sharePrice());
        summary.lockPolicy = vault.lockPolicy().name();
        summary.lockUpPeriod = vault.minLockUpPeriod().toString();
        return summary;
    }

    @WithSpan
    public Result<PositionResponse, DomainError> position(final String holderValue) {
        return validator.address(holderValue, "holder").map(this::position);
    }

    private PositionResponse position(final Address holder) {
        BigInteger shares = vault.balanceOf(holder);
        Optional<Instant> lockedUntil = vault.lockedUntil(holder);
        return new PositionResponse(
                holder.value(),
                Amounts.format(shares),
                Amounts.format(vault.previewRedeem(shares)),
                lockedUntil.map(Instant::toString).orElse(null),
                vault.isLocked(holder));
    }

    private DepositResponse toResponse(final DepositReceipt receipt) {
        return new DepositResponse(
                receipt.holder().value(),
                receipt.asset().symbol(),
                Amounts.format(receipt.amount()),
                Amounts.format(receipt.depositValue()),
                Amounts.format(receipt.sharesMinted()),
                receipt.lockedUntil().toString());
    }

    private WithdrawResponse toResponse(final WithdrawalReceipt receipt, final BigInteger shares) {
        return new WithdrawResponse(
                receipt.recipient().value(),
                Amounts.format(shares),
                vault.strategy().map(s -> s.settlementAsset().symbol()).orElse(null),
                Amounts.format(receipt.settlementOut()),
                Amounts.format(receipt.nativeOut()));
    }

    private void refreshGauges() {
        metrics.updatePool(Amounts.toUnits(vault.totalAssets()), Amounts.toUnits(vault.sharePrice()));
    }

    private void reject(final String operation, final String holder, final DomainError error) {
        metrics.recordFailure(operation, error.code());
        LOG.warn("{} rejected for {}: {}", operation, holder, error);
    }
}
