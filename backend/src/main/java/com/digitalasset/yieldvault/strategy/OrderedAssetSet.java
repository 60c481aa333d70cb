// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Asset;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Asset set with constant-time membership and insertion-order enumeration. Withdrawal walks
 * holdings in this order, so the order is part of the observable behaviour.
 */
public final class OrderedAssetSet {

    private final LinkedHashSet<Asset> assets = new LinkedHashSet<>();

    /**
     * @return false if the asset was already present (its position is kept)
     */
    public boolean add(final Asset asset) {
        return assets.add(asset);
    }

    public boolean remove(final Asset asset) {
        return assets.remove(asset);
    }

    public boolean contains(final Asset asset) {
        return assets.contains(asset);
    }

    public int size() {
        return assets.size();
    }

    public List<Asset> toList() {
        return List.copyOf(assets);
    }

    OrderedAssetSet copy() {
        OrderedAssetSet copy = new OrderedAssetSet();
        copy.assets.addAll(assets);
        return copy;
    }

    void restoreFrom(final OrderedAssetSet other) {
        assets.clear();
        assets.addAll(other.assets);
    }
}
