// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.constants;

import java.math.BigInteger;
import java.time.Duration;

/**
 * Centralized constants for vault and strategy accounting.
 *
 * All on-ledger quantities are integers in base units (18 decimals). Rates are 18-decimal
 * fixed point as well.
 */
public final class VaultConstants {

    private VaultConstants() {
        // Prevent instantiation
    }

    // ========================================
    // PRECISION & SCALE
    // ========================================

    /**
     * Decimal places of every asset and of the share token.
     */
    public static final int DECIMALS = 18;

    /**
     * One whole unit (1e18 base units). Also the fixed-point denominator of rates.
     */
    public static final BigInteger WAD = BigInteger.TEN.pow(DECIMALS);

    /**
     * Largest accepted request amount, in whole-unit digits before the decimal point.
     */
    public static final int MAX_AMOUNT_INTEGER_DIGITS = 30;

    /**
     * Most decimal places accepted in a request amount; digits past {@link #DECIMALS} are dropped.
     */
    public static final int MAX_AMOUNT_SCALE = 36;

    // ========================================
    // STRATEGY
    // ========================================

    /**
     * Registry receipts below this amount are left in reserve on withdrawal instead of
     * being redeemed.
     */
    public static final BigInteger DEFAULT_REGISTRY_DUST_FLOOR = BigInteger.TEN.pow(9);

    // ========================================
    // VAULT
    // ========================================

    /**
     * Default minimum time between a deposit and the depositor's earliest withdrawal.
     */
    public static final Duration DEFAULT_MIN_LOCK_UP_PERIOD = Duration.ofDays(1);

    /**
     * Default minimum deposit of an underlying asset (0.01 units). The only guard
     * against first-depositor share inflation, keep it non-trivial.
     */
    public static final BigInteger DEFAULT_MIN_DEPOSIT = WAD.divide(BigInteger.valueOf(100));

    // ========================================
    // ADDRESSES
    // ========================================

    /**
     * Sentinel address identifying the native coin in asset maps.
     */
    public static final String NATIVE_COIN_SENTINEL = "0xeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeeee";

    /**
     * Symbol used for the native coin.
     */
    public static final String NATIVE_COIN_SYMBOL = "ETH";
}
