// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Known assets by symbol, so API callers can name assets instead of quoting addresses.
 */
public class AssetDirectory {

    private final Map<String, Asset> bySymbol = new LinkedHashMap<>();

    public AssetDirectory() {
        add(Asset.NATIVE);
    }

    public Asset add(final Asset asset) {
        bySymbol.put(key(asset.symbol()), asset);
        return asset;
    }

    /**
     * Resolves a symbol (case-insensitive) or a token address.
     */
    public Optional<Asset> resolve(final String symbolOrAddress) {
        if (symbolOrAddress == null || symbolOrAddress.isBlank()) {
            return Optional.empty();
        }
        Asset bySym = bySymbol.get(key(symbolOrAddress));
        if (bySym != null) {
            return Optional.of(bySym);
        }
        String lowered = symbolOrAddress.trim().toLowerCase(Locale.ROOT);
        return bySymbol.values().stream()
                .filter(asset -> asset.address().value().equals(lowered))
                .findFirst();
    }

    public Collection<Asset> all() {
        return Collections.unmodifiableCollection(bySymbol.values());
    }

    private static String key(final String symbol) {
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
