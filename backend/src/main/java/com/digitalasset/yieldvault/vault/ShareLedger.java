// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Share token of one vault: balances per holder and the total supply.
 */
public final class ShareLedger {

    private final Map<Address, BigInteger> balances = new LinkedHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public BigInteger totalSupply() {
        return totalSupply;
    }

    public BigInteger balanceOf(final Address holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }

    public Map<Address, BigInteger> holders() {
        return Collections.unmodifiableMap(balances);
    }

    public void mint(final Address holder, final BigInteger amount) {
        balances.merge(holder, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
    }

    public void burn(final Address holder, final BigInteger amount) {
        BigInteger balance = balanceOf(holder);
        if (balance.compareTo(amount) < 0) {
            throw new DomainException(new InsufficientBalanceError(
                    holder + " holds " + balance + " shares, cannot redeem " + amount));
        }
        balances.put(holder, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    ShareLedger copy() {
        ShareLedger copy = new ShareLedger();
        copy.restoreFrom(this);
        return copy;
    }

    void restoreFrom(final ShareLedger other) {
        if (other == this) {
            return;
        }
        balances.clear();
        balances.putAll(other.balances);
        totalSupply = other.totalSupply;
    }
}
