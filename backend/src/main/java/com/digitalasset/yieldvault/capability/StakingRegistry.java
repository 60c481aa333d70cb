// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.capability;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;

/**
 * External custodian that takes the settlement asset and mints a yield-bearing receipt.
 */
public interface StakingRegistry {

    Address address();

    Asset settlementAsset();

    Asset receiptAsset();

    /**
     * Takes {@code amount} of the settlement asset from {@code owner} and mints receipts to it.
     */
    void deposit(Address owner, BigInteger amount);

    /**
     * Burns {@code amount} receipts of {@code owner} and pays the settlement proceeds to
     * {@code recipient}. Callers must check {@link #isWithdrawEligible} first.
     *
     * @return the proceeds as reported by the registry
     */
    BigInteger withdraw(Address owner, Address recipient, BigInteger amount);

    /**
     * Whether {@code owner}'s receipts may currently be redeemed or moved.
     */
    boolean isWithdrawEligible(Address owner);
}
