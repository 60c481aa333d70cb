// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Metrics collector for vault, strategy and backstop operations.
 *
 * Provides Micrometer metrics for:
 * - Deposit, withdrawal and swap counters
 * - Failures by operation and error code
 * - Pool gauges (total assets, share price), registered once and updated after each call
 *
 * CARDINALITY SAFETY: tags are asset symbols, operation names and error codes, never holder
 * addresses.
 */
@Component
public class VaultMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter withdrawals;
    private final Counter backstopSwaps;
    private final AtomicReference<BigDecimal> totalAssets = new AtomicReference<>(BigDecimal.ZERO);
    private final AtomicReference<BigDecimal> sharePrice = new AtomicReference<>(BigDecimal.ONE);

    public VaultMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.withdrawals = Counter.builder("yieldvault.vault.withdrawals.total")
            .description("Total number of successful withdrawals")
            .register(meterRegistry);

        this.backstopSwaps = Counter.builder("yieldvault.backstop.swaps.total")
            .description("Total number of native-coin backstop swaps")
            .register(meterRegistry);

        Gauge.builder("yieldvault.vault.total_assets", totalAssets, r -> r.get().doubleValue())
            .description("Strategy total value in settlement units")
            .register(meterRegistry);

        Gauge.builder("yieldvault.vault.share_price", sharePrice, r -> r.get().doubleValue())
            .description("Settlement value of one share")
            .register(meterRegistry);
    }

    public void recordDeposit(String assetSymbol) {
        meterRegistry.counter("yieldvault.vault.deposits.total", "asset", assetSymbol).increment();
    }

    public void recordWithdrawal() {
        withdrawals.increment();
    }

    public void recordSwap(String inputSymbol, String outputSymbol) {
        meterRegistry.counter("yieldvault.strategy.swaps.total",
            "pair", inputSymbol + "-" + outputSymbol).increment();
    }

    public void recordBackstopSwap() {
        backstopSwaps.increment();
    }

    public void recordFailure(String operation, String errorCode) {
        meterRegistry.counter("yieldvault.failures.total",
            "operation", operation,
            "code", errorCode == null ? "unknown" : errorCode).increment();
    }

    /**
     * Update pool gauges (values in settlement units).
     */
    public void updatePool(BigDecimal totalAssetsUnits, BigDecimal sharePriceUnits) {
        totalAssets.set(totalAssetsUnits);
        sharePrice.set(sharePriceUnits);
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
