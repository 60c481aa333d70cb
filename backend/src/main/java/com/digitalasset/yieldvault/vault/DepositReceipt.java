// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Outcome of an accepted deposit.
 *
 * @param depositValue settlement value the deposit added to the pool
 * @param sharesMinted shares credited to the holder
 * @param lockedUntil  earliest instant the holder may withdraw
 */
public record DepositReceipt(
        Address holder,
        Asset asset,
        BigInteger amount,
        BigInteger depositValue,
        BigInteger sharesMinted,
        Instant lockedUntil
) {
}
