// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.validation;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.AssetDirectory;
import com.digitalasset.yieldvault.common.DomainError;
import com.digitalasset.yieldvault.common.Result;
import com.digitalasset.yieldvault.common.errors.UnknownAssetError;
import com.digitalasset.yieldvault.common.errors.ValidationError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;
import com.digitalasset.yieldvault.constants.VaultConstants;
import com.digitalasset.yieldvault.util.Amounts;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;

/**
 * Parses request fields into domain values.
 *
 * Only shape is checked here (well-formed address, known asset, non-negative decimal); business
 * rules such as minimums and ceilings stay with the vault and strategy.
 */
@Component
public class RequestValidator {

    private final AssetDirectory assets;

    public RequestValidator(final AssetDirectory assets) {
        this.assets = assets;
    }

    public Result<Address, DomainError> address(final String value, final String field) {
        if (value == null || value.isBlank()) {
            return Result.err(new ValidationError(field + " is required"));
        }
        Address parsed;
        try {
            parsed = Address.of(value);
        } catch (IllegalArgumentException e) {
            return Result.err(new ValidationError(field + " is not a valid address: " + value));
        }
        if (parsed.isZero()) {
            return Result.err(new ZeroAddressError(field + " must not be the zero address"));
        }
        return Result.ok(parsed);
    }

    /**
     * Resolves a symbol (case-insensitive) or token address.
     */
    public Result<Asset, DomainError> asset(final String value, final String field) {
        if (value == null || value.isBlank()) {
            return Result.err(new ValidationError(field + " is required"));
        }
        return assets.resolve(value)
                .<Result<Asset, DomainError>>map(Result::ok)
                .orElseGet(() -> Result.err(new UnknownAssetError(field + " " + value + " is not a known asset")));
    }

    /**
     * Decimal units to base units; digits past the 18th decimal are dropped.
     */
    public Result<BigInteger, DomainError> amount(final String value, final String field) {
        if (value == null || value.isBlank()) {
            return Result.err(new ValidationError(field + " is required"));
        }
        BigDecimal units;
        try {
            units = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            return Result.err(new ValidationError(field + " is not a decimal number: " + value));
        }
        if (units.signum() < 0) {
            return Result.err(new ValidationError(field + " cannot be negative, got: " + value));
        }
        BigDecimal normalized = units.stripTrailingZeros();
        long integerDigits = (long) normalized.precision() - normalized.scale();
        if (integerDigits > VaultConstants.MAX_AMOUNT_INTEGER_DIGITS) {
            return Result.err(new ValidationError(field + " is too large: " + value));
        }
        if (normalized.scale() > VaultConstants.MAX_AMOUNT_SCALE) {
            return Result.err(new ValidationError(
                    field + " has more than " + VaultConstants.MAX_AMOUNT_SCALE + " decimal places: " + value));
        }
        return Result.ok(Amounts.toBaseUnits(units));
    }
}
