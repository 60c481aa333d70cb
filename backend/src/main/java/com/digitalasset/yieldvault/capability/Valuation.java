// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.capability;

import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;

/**
 * Converts asset quantities to settlement-asset value using live rates. Implementations must
 * not cache: the underlying rates accrue yield over time.
 */
@FunctionalInterface
public interface Valuation {

    BigInteger settlementValue(Asset asset, BigInteger quantity);
}
