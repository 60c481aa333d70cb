// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.config;

import com.digitalasset.yieldvault.constants.VaultConstants;
import com.digitalasset.yieldvault.vault.LockPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Vault, sibling vault and simulated-world settings ({@code yieldvault.*}).
 *
 * Amounts are decimal units (18 decimals), except the dust floor which is in base units.
 */
@Validated
@ConfigurationProperties(prefix = "yieldvault")
public class YieldVaultProperties {

    @NotNull
    private Duration lockUpPeriod = VaultConstants.DEFAULT_MIN_LOCK_UP_PERIOD;

    @NotNull
    private LockPolicy lockPolicy = LockPolicy.PER_HOLDER;

    @NotNull
    private BigInteger registryDustFloor = VaultConstants.DEFAULT_REGISTRY_DUST_FLOOR;

    @Valid
    private Sibling sibling = new Sibling();

    @Valid
    private Simulation simulation = new Simulation();

    public Duration getLockUpPeriod() {
        return lockUpPeriod;
    }

    public void setLockUpPeriod(Duration lockUpPeriod) {
        this.lockUpPeriod = lockUpPeriod;
    }

    public LockPolicy getLockPolicy() {
        return lockPolicy;
    }

    public void setLockPolicy(LockPolicy lockPolicy) {
        this.lockPolicy = lockPolicy;
    }

    public BigInteger getRegistryDustFloor() {
        return registryDustFloor;
    }

    public void setRegistryDustFloor(BigInteger registryDustFloor) {
        this.registryDustFloor = registryDustFloor;
    }

    public Sibling getSibling() {
        return sibling;
    }

    public void setSibling(Sibling sibling) {
        this.sibling = sibling;
    }

    public Simulation getSimulation() {
        return simulation;
    }

    public void setSimulation(Simulation simulation) {
        this.simulation = simulation;
    }

    /**
     * Single-asset vault holding the settlement asset.
     */
    public static class Sibling {
        @NotNull
        private Duration lockUpPeriod = VaultConstants.DEFAULT_MIN_LOCK_UP_PERIOD;

        @NotNull
        @DecimalMin("0")
        private BigDecimal depositMinimum = new BigDecimal("0.01");

        public Duration getLockUpPeriod() {
            return lockUpPeriod;
        }

        public void setLockUpPeriod(Duration lockUpPeriod) {
            this.lockUpPeriod = lockUpPeriod;
        }

        public BigDecimal getDepositMinimum() {
            return depositMinimum;
        }

        public void setDepositMinimum(BigDecimal depositMinimum) {
            this.depositMinimum = depositMinimum;
        }
    }

    /**
     * The in-memory world the backend runs against.
     */
    public static class Simulation {
        @NotBlank
        private String owner = "owner";

        @NotBlank
        private String manager = "manager";

        @NotBlank
        private String settlementAsset = "WETH";

        @NotBlank
        private String receiptAsset = "stWETH";

        /** Settlement units per receipt. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal registryRate = BigDecimal.ONE;

        @NotNull
        private Duration registryCooldown = Duration.ZERO;

        /** Settlement units per native coin. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal nativeRate = BigDecimal.ONE;

        /** Native coin and settlement asset minted to the router. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal swapLiquidity = new BigDecimal("1000");

        private boolean devnetEndpoints = true;

        @NotEmpty
        @Valid
        private List<UnderlyingAsset> underlyingAssets = new ArrayList<>();

        public String getOwner() {
            return owner;
        }

        public void setOwner(String owner) {
            this.owner = owner;
        }

        public String getManager() {
            return manager;
        }

        public void setManager(String manager) {
            this.manager = manager;
        }

        public String getSettlementAsset() {
            return settlementAsset;
        }

        public void setSettlementAsset(String settlementAsset) {
            this.settlementAsset = settlementAsset;
        }

        public String getReceiptAsset() {
            return receiptAsset;
        }

        public void setReceiptAsset(String receiptAsset) {
            this.receiptAsset = receiptAsset;
        }

        public BigDecimal getRegistryRate() {
            return registryRate;
        }

        public void setRegistryRate(BigDecimal registryRate) {
            this.registryRate = registryRate;
        }

        public Duration getRegistryCooldown() {
            return registryCooldown;
        }

        public void setRegistryCooldown(Duration registryCooldown) {
            this.registryCooldown = registryCooldown;
        }

        public BigDecimal getNativeRate() {
            return nativeRate;
        }

        public void setNativeRate(BigDecimal nativeRate) {
            this.nativeRate = nativeRate;
        }

        public BigDecimal getSwapLiquidity() {
            return swapLiquidity;
        }

        public void setSwapLiquidity(BigDecimal swapLiquidity) {
            this.swapLiquidity = swapLiquidity;
        }

        public boolean isDevnetEndpoints() {
            return devnetEndpoints;
        }

        public void setDevnetEndpoints(boolean devnetEndpoints) {
            this.devnetEndpoints = devnetEndpoints;
        }

        public List<UnderlyingAsset> getUnderlyingAssets() {
            return underlyingAssets;
        }

        public void setUnderlyingAssets(List<UnderlyingAsset> underlyingAssets) {
            this.underlyingAssets = underlyingAssets;
        }
    }

    /**
     * One accepted deposit asset. When {@code unwrappedSymbol} is set, deposits of that asset are
     * wrapped into this one at {@code wrapRatio} first.
     */
    public static class UnderlyingAsset {
        @NotBlank
        private String symbol;

        /** Settlement units per unit of this asset. */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal rate = BigDecimal.ONE;

        @NotNull
        @DecimalMin("0")
        private BigDecimal minDeposit = new BigDecimal("0.01");

        /** Zero disables the ceiling. */
        @NotNull
        @DecimalMin("0")
        private BigDecimal depositCeiling = BigDecimal.ZERO;

        private String unwrappedSymbol;

        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal wrapRatio = BigDecimal.ONE;

        private boolean routeToNative = true;

        public String getSymbol() {
            return symbol;
        }

        public void setSymbol(String symbol) {
            this.symbol = symbol;
        }

        public BigDecimal getRate() {
            return rate;
        }

        public void setRate(BigDecimal rate) {
            this.rate = rate;
        }

        public BigDecimal getMinDeposit() {
            return minDeposit;
        }

        public void setMinDeposit(BigDecimal minDeposit) {
            this.minDeposit = minDeposit;
        }

        public BigDecimal getDepositCeiling() {
            return depositCeiling;
        }

        public void setDepositCeiling(BigDecimal depositCeiling) {
            this.depositCeiling = depositCeiling;
        }

        public String getUnwrappedSymbol() {
            return unwrappedSymbol;
        }

        public void setUnwrappedSymbol(String unwrappedSymbol) {
            this.unwrappedSymbol = unwrappedSymbol;
        }

        public BigDecimal getWrapRatio() {
            return wrapRatio;
        }

        public void setWrapRatio(BigDecimal wrapRatio) {
            this.wrapRatio = wrapRatio;
        }

        public boolean isRouteToNative() {
            return routeToNative;
        }

        public void setRouteToNative(boolean routeToNative) {
            this.routeToNative = routeToNative;
        }
    }
}
