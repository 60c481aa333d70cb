// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Asset;

/**
 * Directed swap route: {@code in} is sold for {@code out}.
 */
public record AssetPair(Asset in, Asset out) {

    @Override
    public String toString() {
        return in + "->" + out;
    }
}
