// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.devnet;

import com.digitalasset.yieldvault.capability.StakingRegistry;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.Snapshotable;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import com.digitalasset.yieldvault.common.errors.WithdrawalNotEligibleError;
import com.digitalasset.yieldvault.constants.VaultConstants;
import com.digitalasset.yieldvault.util.ShareMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Staking registry with a settable exchange rate (settlement units per receipt, 18 decimals),
 * a redemption fee in basis points and a cooldown after each deposit during which the
 * depositor's receipts cannot be redeemed.
 *
 * Yield is modelled by raising the exchange rate; the registry mints any settlement shortfall
 * it needs to honour redemptions at the higher rate.
 */
public class SimulatedStakingRegistry implements StakingRegistry, Snapshotable {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedStakingRegistry.class);
    private static final BigInteger BPS = BigInteger.valueOf(10_000);

    private final Address address;
    private final ChainState chain;
    private final Asset settlementAsset;
    private final Asset receiptAsset;
    private final Map<Address, Instant> lastDeposit = new HashMap<>();

    private BigInteger exchangeRate = VaultConstants.WAD;
    private int redemptionFeeBps;
    private Duration cooldown = Duration.ZERO;

    public SimulatedStakingRegistry(final String name, final ChainState chain, final Asset settlementAsset, final Asset receiptAsset) {
        this.address = Address.derive("registry:" + name);
        this.chain = chain;
        this.settlementAsset = settlementAsset;
        this.receiptAsset = receiptAsset;
        chain.register(this);
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Asset settlementAsset() {
        return settlementAsset;
    }

    @Override
    public Asset receiptAsset() {
        return receiptAsset;
    }

    public BigInteger exchangeRate() {
        return exchangeRate;
    }

    public void setExchangeRate(final BigInteger rate) {
        if (rate.signum() <= 0) {
            throw new IllegalArgumentException("exchange rate must be positive: " + rate);
        }
        this.exchangeRate = rate;
    }

    public void setRedemptionFeeBps(final int feeBps) {
        if (feeBps < 0 || feeBps > 10_000) {
            throw new IllegalArgumentException("fee must be within 0..10000 bps: " + feeBps);
        }
        this.redemptionFeeBps = feeBps;
    }

    public void setCooldown(final Duration cooldown) {
        this.cooldown = cooldown;
    }

    @Override
    public void deposit(final Address owner, final BigInteger amount) {
        chain.atomicallyRun(() -> {
            BigInteger minted = ShareMath.divideByRate(amount, exchangeRate);
            if (minted.signum() == 0) {
                throw new DomainException(new TooSmallError("stake of " + amount + " mints no receipts"));
            }
            chain.transfer(settlementAsset, owner, address, amount);
            chain.mint(receiptAsset, owner, minted);
            lastDeposit.put(owner, chain.now());
            logger.debug("Registry staked {} {} for {}: {} {}", amount, settlementAsset, owner, minted, receiptAsset);
        });
    }

    @Override
    public BigInteger withdraw(final Address owner, final Address recipient, final BigInteger amount) {
        return chain.atomically(() -> {
            if (!isWithdrawEligible(owner)) {
                throw new DomainException(new WithdrawalNotEligibleError(owner + " is in its redemption cooldown"));
            }
            chain.burn(receiptAsset, owner, amount);
            BigInteger gross = ShareMath.applyRate(amount, exchangeRate);
            BigInteger proceeds = gross.subtract(ShareMath.mulDiv(gross, BigInteger.valueOf(redemptionFeeBps), BPS));
            BigInteger held = chain.balanceOf(settlementAsset, address);
            if (held.compareTo(proceeds) < 0) {
                chain.mint(settlementAsset, address, proceeds.subtract(held));
            }
            chain.transfer(settlementAsset, address, recipient, proceeds);
            logger.debug("Registry redeemed {} {} of {}: {} {} to {}", amount, receiptAsset, owner, proceeds, settlementAsset, recipient);
            return proceeds;
        });
    }

    @Override
    public boolean isWithdrawEligible(final Address owner) {
        Instant last = lastDeposit.get(owner);
        return last == null || !chain.now().isBefore(last.plus(cooldown));
    }

    @Override
    public Runnable snapshot() {
        Map<Address, Instant> savedDeposits = new HashMap<>(lastDeposit);
        BigInteger savedRate = exchangeRate;
        int savedFee = redemptionFeeBps;
        Duration savedCooldown = cooldown;
        return () -> {
            lastDeposit.clear();
            lastDeposit.putAll(savedDeposits);
            exchangeRate = savedRate;
            redemptionFeeBps = savedFee;
            cooldown = savedCooldown;
        };
    }
}
