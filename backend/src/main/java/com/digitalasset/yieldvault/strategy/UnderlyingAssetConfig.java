// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import java.math.BigInteger;

/**
 * Acceptance rules for one underlying asset.
 *
 * @param minDepositAmount smallest accepted deposit, in base units of the canonical asset
 * @param depositCeiling   cap on the asset's reserve after a deposit; zero disables the cap
 */
public record UnderlyingAssetConfig(BigInteger minDepositAmount, BigInteger depositCeiling) {

    public UnderlyingAssetConfig {
        if (minDepositAmount == null || minDepositAmount.signum() < 0) {
            throw new IllegalArgumentException("minDepositAmount must be non-negative");
        }
        if (depositCeiling == null || depositCeiling.signum() < 0) {
            throw new IllegalArgumentException("depositCeiling must be non-negative");
        }
    }

    public static UnderlyingAssetConfig withMinimum(final BigInteger minDepositAmount) {
        return new UnderlyingAssetConfig(minDepositAmount, BigInteger.ZERO);
    }

    public boolean hasCeiling() {
        return depositCeiling.signum() > 0;
    }

    public UnderlyingAssetConfig withCeiling(final BigInteger ceiling) {
        return new UnderlyingAssetConfig(minDepositAmount, ceiling);
    }

    public UnderlyingAssetConfig withMinDeposit(final BigInteger minimum) {
        return new UnderlyingAssetConfig(minimum, depositCeiling);
    }
}
