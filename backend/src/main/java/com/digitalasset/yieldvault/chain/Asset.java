// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import com.digitalasset.yieldvault.constants.VaultConstants;

/**
 * A fungible asset: either a token identified by its contract address or the native coin.
 */
public record Asset(String symbol, Address address) {

    public static final Asset NATIVE = new Asset(
            VaultConstants.NATIVE_COIN_SYMBOL, Address.of(VaultConstants.NATIVE_COIN_SENTINEL));

    public Asset {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("asset symbol is required");
        }
        if (address == null || address.isZero()) {
            throw new IllegalArgumentException("asset address must not be zero: " + symbol);
        }
    }

    /**
     * Token whose address is derived from its symbol.
     */
    public static Asset token(final String symbol) {
        return new Asset(symbol, Address.derive("token:" + symbol));
    }

    public boolean isNative() {
        return equals(NATIVE);
    }

    @Override
    public String toString() {
        return symbol;
    }
}
