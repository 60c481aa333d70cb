// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.util;

import com.digitalasset.yieldvault.constants.VaultConstants;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * Conversions between base units and the decimal strings the API speaks.
 */
public final class Amounts {

    private Amounts() {
        // Utility class
    }

    /**
     * Decimal units to base units, rounding down past 18 decimals.
     */
    public static BigInteger toBaseUnits(final BigDecimal units) {
        return units.movePointRight(VaultConstants.DECIMALS)
                .setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact();
    }

    /**
     * Shorthand for {@code toBaseUnits(new BigDecimal(units))}, e.g. {@code units("0.02")}.
     */
    public static BigInteger units(final String units) {
        return toBaseUnits(new BigDecimal(units));
    }

    public static BigDecimal toUnits(final BigInteger baseUnits) {
        if (baseUnits.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return new BigDecimal(baseUnits, VaultConstants.DECIMALS).stripTrailingZeros();
    }

    public static String format(final BigInteger baseUnits) {
        return toUnits(baseUnits).toPlainString();
    }
}
