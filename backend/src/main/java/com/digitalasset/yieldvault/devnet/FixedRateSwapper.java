// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.devnet;

import com.digitalasset.yieldvault.capability.Swapper;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.FailedToSendEthError;
import com.digitalasset.yieldvault.common.errors.NotSupportedSwapperError;
import com.digitalasset.yieldvault.common.errors.SlippageExceededError;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import com.digitalasset.yieldvault.strategy.AssetPair;
import com.digitalasset.yieldvault.util.ShareMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Swap venue quoting a fixed 18-decimal rate per route and paying out of its own balances.
 * A venue without enough output inventory fails with InsufficientBalance.
 */
public class FixedRateSwapper implements Swapper {

    private static final Logger logger = LoggerFactory.getLogger(FixedRateSwapper.class);

    private final Address address;
    private final ChainState chain;
    private final Map<AssetPair, BigInteger> rates = new ConcurrentHashMap<>();

    public FixedRateSwapper(final String name, final ChainState chain) {
        this.address = Address.derive("swapper:" + name);
        this.chain = chain;
    }

    @Override
    public Address address() {
        return address;
    }

    public FixedRateSwapper quote(final Asset tokenIn, final Asset tokenOut, final BigInteger rate) {
        rates.put(new AssetPair(tokenIn, tokenOut), rate);
        return this;
    }

    public BigInteger expectedOutput(final Asset tokenIn, final BigInteger amountIn, final Asset tokenOut) {
        BigInteger rate = rates.get(new AssetPair(tokenIn, tokenOut));
        if (rate == null) {
            throw new DomainException(new NotSupportedSwapperError(
                    address + " does not quote " + tokenIn + "->" + tokenOut));
        }
        return ShareMath.applyRate(amountIn, rate);
    }

    @Override
    public BigInteger swap(
            final Address caller,
            final Asset tokenIn,
            final BigInteger amountIn,
            final Asset tokenOut,
            final BigInteger minAmountOut
    ) {
        return chain.atomically(() -> {
            if (amountIn.signum() <= 0) {
                throw new DomainException(new TooSmallError("swap amount must be positive"));
            }
            BigInteger amountOut = expectedOutput(tokenIn, amountIn, tokenOut);
            if (amountOut.compareTo(minAmountOut) < 0) {
                throw new DomainException(new SlippageExceededError(
                        "output " + amountOut + " " + tokenOut + " is below the minimum " + minAmountOut));
            }
            chain.transfer(tokenIn, caller, address, amountIn);
            if (tokenOut.isNative()) {
                if (!chain.sendNative(address, caller, amountOut)) {
                    throw new DomainException(new FailedToSendEthError(caller + " rejected swap output"));
                }
            } else {
                chain.transfer(tokenOut, address, caller, amountOut);
            }
            logger.debug("{} swapped {} {} -> {} {} for {}", address, amountIn, tokenIn, amountOut, tokenOut, caller);
            return amountOut;
        });
    }
}
