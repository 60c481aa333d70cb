// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.devnet;

import com.digitalasset.yieldvault.capability.Valuation;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.UnknownAssetError;
import com.digitalasset.yieldvault.util.ShareMath;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Valuation backed by settable 18-decimal rates (settlement units per asset unit). A rate may
 * also track a live source, e.g. a registry's exchange rate; it is read on every call.
 */
public class RateTableValuation implements Valuation {

    private final Asset settlementAsset;
    private final Map<Asset, Supplier<BigInteger>> rates = new ConcurrentHashMap<>();

    public RateTableValuation(final Asset settlementAsset) {
        this.settlementAsset = settlementAsset;
    }

    public void setRate(final Asset asset, final BigInteger rate) {
        if (rate.signum() < 0) {
            throw new IllegalArgumentException("rate must not be negative: " + rate);
        }
        rates.put(asset, () -> rate);
    }

    public void trackRate(final Asset asset, final Supplier<BigInteger> source) {
        rates.put(asset, source);
    }

    public boolean isPriced(final Asset asset) {
        return asset.equals(settlementAsset) || rates.containsKey(asset);
    }

    @Override
    public BigInteger settlementValue(final Asset asset, final BigInteger quantity) {
        if (asset.equals(settlementAsset)) {
            return quantity;
        }
        Supplier<BigInteger> rate = rates.get(asset);
        if (rate == null) {
            throw new DomainException(new UnknownAssetError("no rate for " + asset));
        }
        return ShareMath.applyRate(quantity, rate.get());
    }
}
