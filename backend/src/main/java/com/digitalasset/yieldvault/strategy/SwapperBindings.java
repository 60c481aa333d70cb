// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.capability.Swapper;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.NotSupportedSwapperError;
import com.digitalasset.yieldvault.common.errors.SetDefaultSwapperBeforeError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Which swappers may be used for which routes, and which one is the default per route.
 *
 * Enabled bindings gate manager-directed swaps; the default binding is the only route used by
 * unattended conversions during deposit and withdrawal.
 */
public final class SwapperBindings {

    private final Map<Address, Swapper> known = new HashMap<>();
    private final Map<AssetPair, Set<Address>> enabled = new LinkedHashMap<>();
    private final Map<AssetPair, Address> defaults = new LinkedHashMap<>();

    public void enable(final Asset in, final Asset out, final Swapper swapper) {
        if (swapper == null || swapper.address() == null || swapper.address().isZero()) {
            throw new DomainException(new ZeroAddressError("swapper must not be the zero address"));
        }
        known.put(swapper.address(), swapper);
        enabled.computeIfAbsent(new AssetPair(in, out), p -> new LinkedHashSet<>()).add(swapper.address());
    }

    /**
     * Fails with SetDefaultSwapperBefore if the swapper is the route's default: designate another
     * default first.
     */
    public void disable(final Asset in, final Asset out, final Address swapper) {
        AssetPair pair = new AssetPair(in, out);
        if (swapper.equals(defaults.get(pair))) {
            throw new DomainException(new SetDefaultSwapperBeforeError(
                    swapper + " is the default swapper for " + pair + ", set another default before removing it"));
        }
        Set<Address> swappers = enabled.get(pair);
        if (swappers != null) {
            swappers.remove(swapper);
        }
    }

    public void setDefault(final Asset in, final Asset out, final Address swapper) {
        AssetPair pair = new AssetPair(in, out);
        if (!isEnabled(in, out, swapper)) {
            throw new DomainException(new NotSupportedSwapperError(
                    swapper + " is not enabled for " + pair));
        }
        defaults.put(pair, swapper);
    }

    public boolean isEnabled(final Asset in, final Asset out, final Address swapper) {
        Set<Address> swappers = enabled.get(new AssetPair(in, out));
        return swappers != null && swappers.contains(swapper);
    }

    public Optional<Swapper> enabledSwapper(final Asset in, final Asset out, final Address swapper) {
        if (!isEnabled(in, out, swapper)) {
            return Optional.empty();
        }
        return Optional.ofNullable(known.get(swapper));
    }

    public Optional<Swapper> defaultSwapper(final Asset in, final Asset out) {
        Address swapper = defaults.get(new AssetPair(in, out));
        return swapper == null ? Optional.empty() : Optional.ofNullable(known.get(swapper));
    }

    public Map<AssetPair, Address> defaults() {
        return Map.copyOf(defaults);
    }

    SwapperBindings copy() {
        SwapperBindings copy = new SwapperBindings();
        copy.restoreFrom(this);
        return copy;
    }

    void restoreFrom(final SwapperBindings other) {
        if (other == this) {
            return;
        }
        known.clear();
        known.putAll(other.known);
        enabled.clear();
        other.enabled.forEach((pair, swappers) -> enabled.put(pair, new LinkedHashSet<>(swappers)));
        defaults.clear();
        defaults.putAll(other.defaults);
    }
}
