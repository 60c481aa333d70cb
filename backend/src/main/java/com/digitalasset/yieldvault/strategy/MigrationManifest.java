// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * What a migrating strategy handed over, in its holding order.
 */
public record MigrationManifest(Address from, Address to, Map<Asset, BigInteger> transferred) {

    public MigrationManifest {
        transferred = Collections.unmodifiableMap(new LinkedHashMap<>(transferred));
    }

    public BigInteger amountOf(final Asset asset) {
        return transferred.getOrDefault(asset, BigInteger.ZERO);
    }
}
