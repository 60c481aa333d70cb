// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.devnet;

import com.digitalasset.yieldvault.capability.AssetWrapper;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.util.ShareMath;

import java.math.BigInteger;

/**
 * Wraps at a fixed 18-decimal ratio of wrapped units per unwrapped unit: the unwrapped tokens
 * are burned and wrapped ones minted to the holder.
 */
public class RatioWrapper implements AssetWrapper {

    private final ChainState chain;
    private final Asset unwrapped;
    private final Asset wrapped;
    private volatile BigInteger ratio;

    public RatioWrapper(final ChainState chain, final Asset unwrapped, final Asset wrapped, final BigInteger ratio) {
        this.chain = chain;
        this.unwrapped = unwrapped;
        this.wrapped = wrapped;
        this.ratio = ratio;
    }

    @Override
    public Asset unwrapped() {
        return unwrapped;
    }

    @Override
    public Asset wrapped() {
        return wrapped;
    }

    public void setRatio(final BigInteger ratio) {
        this.ratio = ratio;
    }

    @Override
    public BigInteger wrap(final Address holder, final BigInteger amount) {
        return chain.atomically(() -> {
            BigInteger out = ShareMath.applyRate(amount, ratio);
            chain.burn(unwrapped, holder, amount);
            chain.mint(wrapped, holder, out);
            return out;
        });
    }
}
