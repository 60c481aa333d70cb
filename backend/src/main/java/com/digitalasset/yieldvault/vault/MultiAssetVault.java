// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.ReentrancyGuard;
import com.digitalasset.yieldvault.chain.Snapshotable;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.ComeBackLaterError;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;
import com.digitalasset.yieldvault.common.errors.NoBackingValueError;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import com.digitalasset.yieldvault.common.errors.ValidationError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;
import com.digitalasset.yieldvault.security.CapabilityGuard;
import com.digitalasset.yieldvault.strategy.MigrationManifest;
import com.digitalasset.yieldvault.strategy.Strategy;
import com.digitalasset.yieldvault.strategy.WithdrawalReceipt;
import com.digitalasset.yieldvault.util.ShareMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Share-issuing vault in front of a {@link Strategy}.
 *
 * Shares are priced against the strategy's total value measured before the deposit's effects,
 * so tokens sent to the vault or strategy outside of a deposit never mint shares. Every deposit
 * refreshes the depositor's lock.
 */
public class MultiAssetVault implements Snapshotable {

    private static final Logger logger = LoggerFactory.getLogger(MultiAssetVault.class);

    private final Address address;
    private final ChainState chain;
    private final ReentrancyGuard guard;
    private final ShareLedger shares = new ShareLedger();
    private final LockBook locks;

    private Address owner;
    private Strategy strategy;
    private Duration minLockUpPeriod;

    public MultiAssetVault(
            final String name,
            final ChainState chain,
            final Address owner,
            final LockPolicy lockPolicy,
            final Duration minLockUpPeriod
    ) {
        if (owner == null || owner.isZero()) {
            throw new DomainException(new ZeroAddressError("vault owner must not be the zero address"));
        }
        this.address = Address.derive("vault:" + name);
        this.chain = chain;
        this.guard = new ReentrancyGuard("vault:" + name);
        this.locks = new LockBook(lockPolicy);
        this.owner = owner;
        this.minLockUpPeriod = requireNonNegative(minLockUpPeriod);
        chain.register(this);
    }

    public Address address() {
        return address;
    }

    public Address owner() {
        return owner;
    }

    public Optional<Strategy> strategy() {
        return Optional.ofNullable(strategy);
    }

    public Duration minLockUpPeriod() {
        return minLockUpPeriod;
    }

    public LockPolicy lockPolicy() {
        return locks.policy();
    }

    // ========================================
    // DEPOSIT / WITHDRAW
    // ========================================

    /**
     * Moves {@code amount} of {@code asset} from the caller into the strategy and mints shares
     * for the value the strategy gained.
     */
    public DepositReceipt deposit(final Address caller, final Asset asset, final BigInteger amount, final boolean sellForSettlement) {
        return chain.atomically(() -> guard.guarded("deposit", () -> {
            Strategy current = requireStrategy();
            if (caller == null || caller.isZero()) {
                throw new DomainException(new ZeroAddressError("depositor must not be the zero address"));
            }
            if (amount == null || amount.signum() <= 0) {
                throw new DomainException(new TooSmallError("deposit amount must be positive"));
            }

            BigInteger supply = shares.totalSupply();
            BigInteger priorTotal = current.totalAssets();
            if (supply.signum() > 0 && priorTotal.signum() == 0) {
                throw new DomainException(new NoBackingValueError(
                        supply + " shares outstanding but the strategy holds no value"));
            }

            chain.transfer(asset, caller, current.address(), amount);
            current.deposit(address, asset, amount, sellForSettlement);

            BigInteger depositValue = current.totalAssets().subtract(priorTotal);
            if (depositValue.signum() <= 0) {
                throw new DomainException(new TooSmallError(
                        "deposit of " + amount + " " + asset + " added no value"));
            }
            BigInteger minted = ShareMath.sharesForDeposit(depositValue, supply, priorTotal);
            if (minted.signum() == 0) {
                throw new DomainException(new TooSmallError(
                        "deposit value " + depositValue + " is worth less than one share"));
            }
            shares.mint(caller, minted);
            Instant lockedUntil = locks.refresh(caller, chain.now().plus(minLockUpPeriod));

            logger.debug("Deposit {} {} by {}: value={}, shares={}, lockedUntil={}",
                    amount, asset, caller, depositValue, minted, lockedUntil);
            return new DepositReceipt(caller, asset, amount, depositValue, minted, lockedUntil);
        }));
    }

    /**
     * Burns {@code shareAmount} of the caller's shares and pays out the matching fraction of every
     * strategy holding.
     */
    public WithdrawalReceipt withdraw(final Address caller, final BigInteger shareAmount) {
        return chain.atomically(() -> guard.guarded("withdraw", () -> {
            Strategy current = requireStrategy();
            Instant now = chain.now();
            if (locks.isLocked(caller, now)) {
                throw new DomainException(new ComeBackLaterError(
                        String.valueOf(caller), locks.lockedUntil(caller).orElse(now)));
            }
            if (shareAmount == null || shareAmount.signum() <= 0) {
                throw new DomainException(new TooSmallError("share amount must be positive"));
            }
            BigInteger balance = shares.balanceOf(caller);
            if (balance.compareTo(shareAmount) < 0) {
                throw new DomainException(new InsufficientBalanceError(
                        caller + " holds " + balance + " shares, cannot redeem " + shareAmount));
            }

            BigInteger supplyBeforeBurn = shares.totalSupply();
            shares.burn(caller, shareAmount);
            WithdrawalReceipt receipt = current.withdraw(address, shareAmount, supplyBeforeBurn, caller);

            logger.debug("Withdraw {} of {} shares by {}: settlement={}, native={}",
                    shareAmount, supplyBeforeBurn, caller, receipt.settlementOut(), receipt.nativeOut());
            return receipt;
        }));
    }

    // ========================================
    // ADMINISTRATION (owner-only)
    // ========================================

    /**
     * Installs a strategy. Replacing one migrates every reserve: the old strategy hands its
     * funds over, the vault switches to the new strategy and only then does the new strategy
     * book what it received. The whole sequence is one call.
     */
    public void setStrategy(final Address caller, final Strategy newStrategy) {
        chain.atomicallyRun(() -> guard.guardedRun("setStrategy", () -> {
            CapabilityGuard.require(caller, owner, "owner", "setStrategy");
            if (newStrategy == null || newStrategy.address().isZero()) {
                throw new DomainException(new ZeroAddressError("strategy must not be the zero address"));
            }
            Strategy previous = strategy;
            if (previous == null) {
                strategy = newStrategy;
                logger.info("Vault {} uses strategy {}", address, newStrategy.address());
                return;
            }
            if (previous.address().equals(newStrategy.address())) {
                throw new DomainException(new ValidationError(
                        newStrategy.address() + " is already the active strategy", ValidationError.Type.CONFIGURATION));
            }
            BigInteger valueBefore = previous.totalAssets();
            MigrationManifest manifest = previous.migrateFunds(address, newStrategy);
            strategy = newStrategy;
            newStrategy.acceptMigration(address, previous, manifest);
            logger.info("Vault {} migrated from {} to {} (value {} -> {})",
                    address, previous.address(), newStrategy.address(), valueBefore, newStrategy.totalAssets());
        }));
    }

    public void setMinLockUpPeriod(final Address caller, final Duration period) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setMinLockUpPeriod");
            minLockUpPeriod = requireNonNegative(period);
            logger.info("Vault {} lock-up period set to {}", address, period);
        });
    }

    // ========================================
    // READS
    // ========================================

    public BigInteger totalAssets() {
        return chain.read(() -> strategy == null ? BigInteger.ZERO : strategy.totalAssets());
    }

    public BigInteger totalSupply() {
        return chain.read(shares::totalSupply);
    }

    public BigInteger balanceOf(final Address holder) {
        return chain.read(() -> shares.balanceOf(holder));
    }

    public Optional<Instant> lockedUntil(final Address holder) {
        return chain.read(() -> locks.lockedUntil(holder));
    }

    public boolean isLocked(final Address holder) {
        return chain.read(() -> locks.isLocked(holder, chain.now()));
    }

    /**
     * Settlement value of 1e18 shares.
     */
    public BigInteger sharePrice() {
        return chain.read(() -> ShareMath.sharePrice(totalAssets(), shares.totalSupply()));
    }

    /**
     * Shares a deposit would mint at current rates. Ignores wrapping and swap slippage, so the
     * realized amount can differ.
     */
    public BigInteger previewDeposit(final Asset asset, final BigInteger amount) {
        return chain.read(() -> {
            Strategy current = requireStrategy();
            BigInteger supply = shares.totalSupply();
            BigInteger total = current.totalAssets();
            if (supply.signum() > 0 && total.signum() == 0) {
                throw new DomainException(new NoBackingValueError(
                        supply + " shares outstanding but the strategy holds no value"));
            }
            BigInteger value = current.assetValue(asset, amount);
            return ShareMath.sharesForDeposit(value, supply, total);
        });
    }

    /**
     * Settlement value currently backing {@code shareAmount} shares.
     */
    public BigInteger previewRedeem(final BigInteger shareAmount) {
        return chain.read(() -> ShareMath.proportionalAmount(totalAssets(), shareAmount, shares.totalSupply()));
    }

    private Strategy requireStrategy() {
        if (strategy == null) {
            throw new DomainException(new ZeroAddressError("vault " + address + " has no strategy"));
        }
        return strategy;
    }

    private static Duration requireNonNegative(final Duration period) {
        if (period == null || period.isNegative()) {
            throw new DomainException(new ValidationError(
                    "lock-up period must not be negative", ValidationError.Type.CONFIGURATION));
        }
        return period;
    }

    @Override
    public Runnable snapshot() {
        ShareLedger savedShares = shares.copy();
        LockBook savedLocks = locks.copy();
        Address savedOwner = owner;
        Strategy savedStrategy = strategy;
        Duration savedPeriod = minLockUpPeriod;
        return () -> {
            shares.restoreFrom(savedShares);
            locks.restoreFrom(savedLocks);
            owner = savedOwner;
            strategy = savedStrategy;
            minLockUpPeriod = savedPeriod;
        };
    }
}
