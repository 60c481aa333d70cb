// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.capability;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;

/**
 * An external venue that performs one atomic exchange.
 */
public interface Swapper {

    Address address();

    /**
     * Takes {@code amountIn} of {@code tokenIn} from the caller (native coin included) and pays
     * the output to the caller.
     *
     * @return the realized output
     * @throws com.digitalasset.yieldvault.common.DomainException with SlippageExceeded if the
     *         output would be below {@code minAmountOut}
     */
    BigInteger swap(Address caller, Asset tokenIn, BigInteger amountIn, Asset tokenOut, BigInteger minAmountOut);
}
