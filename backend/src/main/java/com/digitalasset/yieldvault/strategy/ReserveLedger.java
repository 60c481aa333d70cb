// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Accounted quantity per asset held by a strategy. This, not the live token balance, is what
 * every proportional calculation reads; tokens sent to the strategy outside of a deposit are
 * never counted. Entries are never removed, only brought to zero.
 */
public final class ReserveLedger {

    private final Map<Asset, BigInteger> entries = new LinkedHashMap<>();

    public BigInteger get(final Asset asset) {
        return entries.getOrDefault(asset, BigInteger.ZERO);
    }

    public BigInteger credit(final Asset asset, final BigInteger amount) {
        requireNonNegative(amount);
        return entries.merge(asset, amount, BigInteger::add);
    }

    public BigInteger debit(final Asset asset, final BigInteger amount) {
        requireNonNegative(amount);
        BigInteger current = get(asset);
        if (current.compareTo(amount) < 0) {
            throw new DomainException(new InsufficientBalanceError(
                    "reserve of " + asset + " is " + current + ", cannot release " + amount));
        }
        BigInteger updated = current.subtract(amount);
        entries.put(asset, updated);
        return updated;
    }

    /**
     * Sets the entry to zero and returns what it held.
     */
    public BigInteger drain(final Asset asset) {
        BigInteger current = get(asset);
        entries.put(asset, BigInteger.ZERO);
        return current;
    }

    public Map<Asset, BigInteger> view() {
        return Collections.unmodifiableMap(entries);
    }

    ReserveLedger copy() {
        ReserveLedger copy = new ReserveLedger();
        copy.entries.putAll(entries);
        return copy;
    }

    void restoreFrom(final ReserveLedger other) {
        entries.clear();
        entries.putAll(other.entries);
    }

    private static void requireNonNegative(final BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative, got: " + amount);
        }
    }
}
