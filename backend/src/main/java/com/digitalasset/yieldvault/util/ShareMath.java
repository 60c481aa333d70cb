// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.util;

import com.digitalasset.yieldvault.constants.VaultConstants;

import java.math.BigInteger;

/**
 * Share and proportional-withdrawal math shared by both vaults and the strategy.
 *
 * Every division is a floor division, so rounding always leaves the remainder in the pool.
 */
public final class ShareMath {

    private ShareMath() {
        // Utility class
    }

    /**
     * Shares minted for a deposit.
     *
     * @param depositValue  settlement value contributed by the deposit
     * @param totalSupply   share supply before the deposit
     * @param priorTotal    pool value measured before the deposit's effects
     * @return shares to mint (may be zero for dust deposits)
     */
    public static BigInteger sharesForDeposit(
            final BigInteger depositValue,
            final BigInteger totalSupply,
            final BigInteger priorTotal
    ) {
        if (depositValue.signum() <= 0) {
            return BigInteger.ZERO;
        }
        if (totalSupply.signum() == 0) {
            return depositValue;
        }
        return mulDiv(depositValue, totalSupply, priorTotal);
    }

    /**
     * The holder's part of a reserve: {@code reserve * shareAmount / totalSupply}, floored.
     */
    public static BigInteger proportionalAmount(
            final BigInteger reserve,
            final BigInteger shareAmount,
            final BigInteger totalSupply
    ) {
        if (totalSupply.signum() == 0) {
            return BigInteger.ZERO;
        }
        return mulDiv(reserve, shareAmount, totalSupply);
    }

    /**
     * Settlement value of one whole share (1e18 base units). A pool without shares is
     * priced at 1:1.
     */
    public static BigInteger sharePrice(final BigInteger totalAssets, final BigInteger totalSupply) {
        if (totalSupply.signum() == 0) {
            return VaultConstants.WAD;
        }
        return mulDiv(totalAssets, VaultConstants.WAD, totalSupply);
    }

    /**
     * Applies an 18-decimal fixed-point rate: {@code amount * rate / 1e18}, floored.
     */
    public static BigInteger applyRate(final BigInteger amount, final BigInteger rate) {
        return mulDiv(amount, rate, VaultConstants.WAD);
    }

    /**
     * Inverse of {@link #applyRate}: {@code amount * 1e18 / rate}, floored.
     */
    public static BigInteger divideByRate(final BigInteger amount, final BigInteger rate) {
        return mulDiv(amount, VaultConstants.WAD, rate);
    }

    public static BigInteger mulDiv(final BigInteger a, final BigInteger b, final BigInteger denominator) {
        if (denominator.signum() <= 0) {
            throw new ArithmeticException("denominator must be positive, got: " + denominator);
        }
        return a.multiply(b).divide(denominator);
    }
}
