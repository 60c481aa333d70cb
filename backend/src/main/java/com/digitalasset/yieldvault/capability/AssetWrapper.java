// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.capability;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;

/**
 * Converts a non-canonical form of a staking derivative into its canonical wrapped form.
 */
public interface AssetWrapper {

    Asset unwrapped();

    Asset wrapped();

    /**
     * Consumes {@code amount} of the unwrapped asset held by {@code holder} and credits it with
     * the wrapped equivalent.
     *
     * @return the wrapped amount received
     */
    BigInteger wrap(Address holder, BigInteger amount);
}
