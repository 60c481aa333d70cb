// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Address;

import java.math.BigInteger;

/**
 * Outputs paid to a recipient by one withdrawal.
 */
public record WithdrawalReceipt(Address recipient, BigInteger settlementOut, BigInteger nativeOut) {

    public static WithdrawalReceipt empty(final Address recipient) {
        return new WithdrawalReceipt(recipient, BigInteger.ZERO, BigInteger.ZERO);
    }
}
