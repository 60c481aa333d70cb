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
import com.digitalasset.yieldvault.common.errors.FailedToSendEthError;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;
import com.digitalasset.yieldvault.common.errors.NoBackingValueError;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import com.digitalasset.yieldvault.common.errors.ValidationError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;
import com.digitalasset.yieldvault.security.CapabilityGuard;
import com.digitalasset.yieldvault.strategy.WithdrawalReceipt;
import com.digitalasset.yieldvault.util.ShareMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Vault over a single asset that doubles as a native-coin backstop: anyone may hand it native
 * coin for the same quantity of the held asset. Holders redeem a proportional part of both.
 *
 * Native coin and the held asset count 1:1 towards the pool. Only the vault's own ledger is
 * read; direct transfers are ignored.
 */
public class SingleAssetVault implements Snapshotable {

    private static final Logger logger = LoggerFactory.getLogger(SingleAssetVault.class);

    private final Address address;
    private final ChainState chain;
    private final Asset asset;
    private final ReentrancyGuard guard;
    private final ShareLedger shares = new ShareLedger();
    private final LockBook locks = new LockBook(LockPolicy.PER_HOLDER);

    private final Address owner;
    private Duration minLockUpPeriod;
    private BigInteger depositMinimum;
    private BigInteger assetReserve = BigInteger.ZERO;
    private BigInteger nativeReserve = BigInteger.ZERO;

    public SingleAssetVault(
            final String name,
            final ChainState chain,
            final Asset asset,
            final Address owner,
            final Duration minLockUpPeriod,
            final BigInteger depositMinimum
    ) {
        if (owner == null || owner.isZero()) {
            throw new DomainException(new ZeroAddressError("vault owner must not be the zero address"));
        }
        if (asset.isNative()) {
            throw new DomainException(new ValidationError(
                    "the held asset cannot be the native coin", ValidationError.Type.CONFIGURATION));
        }
        this.address = Address.derive("single-vault:" + name);
        this.chain = chain;
        this.asset = asset;
        this.guard = new ReentrancyGuard("single-vault:" + name);
        this.owner = owner;
        this.minLockUpPeriod = minLockUpPeriod;
        this.depositMinimum = depositMinimum;
        chain.register(this);
    }

    public Address address() {
        return address;
    }

    public Asset asset() {
        return asset;
    }

    public Address owner() {
        return owner;
    }

    public DepositReceipt deposit(final Address caller, final BigInteger amount) {
        return chain.atomically(() -> guard.guarded("deposit", () -> {
            if (caller == null || caller.isZero()) {
                throw new DomainException(new ZeroAddressError("depositor must not be the zero address"));
            }
            if (amount == null || amount.signum() <= 0 || amount.compareTo(depositMinimum) < 0) {
                throw new DomainException(new TooSmallError(
                        "deposit of " + amount + " " + asset + " is below the minimum " + depositMinimum));
            }
            BigInteger supply = shares.totalSupply();
            BigInteger totalHeld = assetReserve.add(nativeReserve);
            if (supply.signum() > 0 && totalHeld.signum() == 0) {
                throw new DomainException(new NoBackingValueError(
                        supply + " shares outstanding but the vault holds nothing"));
            }
            BigInteger minted = ShareMath.sharesForDeposit(amount, supply, totalHeld);
            if (minted.signum() == 0) {
                throw new DomainException(new TooSmallError("deposit is worth less than one share"));
            }

            chain.transfer(asset, caller, address, amount);
            assetReserve = assetReserve.add(amount);
            shares.mint(caller, minted);
            Instant lockedUntil = locks.refresh(caller, chain.now().plus(minLockUpPeriod));

            logger.debug("Deposit {} {} by {}: shares={}, lockedUntil={}", amount, asset, caller, minted, lockedUntil);
            return new DepositReceipt(caller, asset, amount, amount, minted, lockedUntil);
        }));
    }

    /**
     * Pays the caller its part of both reserves. {@link WithdrawalReceipt#settlementOut()} is the
     * held asset.
     */
    public WithdrawalReceipt withdraw(final Address caller, final BigInteger shareAmount) {
        return chain.atomically(() -> guard.guarded("withdraw", () -> {
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

            BigInteger supply = shares.totalSupply();
            BigInteger assetOut = ShareMath.proportionalAmount(assetReserve, shareAmount, supply);
            BigInteger nativeOut = ShareMath.proportionalAmount(nativeReserve, shareAmount, supply);
            shares.burn(caller, shareAmount);
            assetReserve = assetReserve.subtract(assetOut);
            nativeReserve = nativeReserve.subtract(nativeOut);

            if (assetOut.signum() > 0) {
                chain.transfer(asset, address, caller, assetOut);
            }
            if (nativeOut.signum() > 0 && !chain.sendNative(address, caller, nativeOut)) {
                throw new DomainException(new FailedToSendEthError(caller + " rejected " + nativeOut + " native coin"));
            }
            logger.debug("Withdraw {} shares by {}: {}={}, native={}", shareAmount, caller, asset, assetOut, nativeOut);
            return new WithdrawalReceipt(caller, assetOut, nativeOut);
        }));
    }

    /**
     * Takes {@code nativeAmount} native coin from the caller and pays the same quantity of the
     * held asset.
     */
    public BigInteger swapNativeForAsset(final Address caller, final BigInteger nativeAmount) {
        return chain.atomically(() -> guard.guarded("swapNativeForAsset", () -> {
            if (caller == null || caller.isZero()) {
                throw new DomainException(new ZeroAddressError("swap caller must not be the zero address"));
            }
            if (nativeAmount == null || nativeAmount.signum() <= 0) {
                throw new DomainException(new TooSmallError("swap amount must be positive"));
            }
            if (assetReserve.compareTo(nativeAmount) < 0) {
                throw new DomainException(new InsufficientBalanceError(
                        "backstop holds " + assetReserve + " " + asset + ", cannot pay " + nativeAmount));
            }
            chain.transfer(Asset.NATIVE, caller, address, nativeAmount);
            nativeReserve = nativeReserve.add(nativeAmount);
            assetReserve = assetReserve.subtract(nativeAmount);
            chain.transfer(asset, address, caller, nativeAmount);
            logger.debug("Backstop swap by {}: {} native for {} {}", caller, nativeAmount, nativeAmount, asset);
            return nativeAmount;
        }));
    }

    public void setMinLockUpPeriod(final Address caller, final Duration period) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setMinLockUpPeriod");
            if (period == null || period.isNegative()) {
                throw new DomainException(new ValidationError(
                        "lock-up period must not be negative", ValidationError.Type.CONFIGURATION));
            }
            minLockUpPeriod = period;
        });
    }

    public void setDepositMinimum(final Address caller, final BigInteger minimum) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setDepositMinimum");
            if (minimum == null || minimum.signum() < 0) {
                throw new DomainException(new ValidationError(
                        "deposit minimum must not be negative", ValidationError.Type.CONFIGURATION));
            }
            depositMinimum = minimum;
        });
    }

    // ========================================
    // READS
    // ========================================

    public BigInteger assetReserve() {
        return chain.read(() -> assetReserve);
    }

    public BigInteger nativeReserve() {
        return chain.read(() -> nativeReserve);
    }

    public BigInteger totalHeld() {
        return chain.read(() -> assetReserve.add(nativeReserve));
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

    public BigInteger depositMinimum() {
        return chain.read(() -> depositMinimum);
    }

    public BigInteger previewRedeem(final BigInteger shareAmount) {
        return chain.read(() -> ShareMath.proportionalAmount(
                assetReserve.add(nativeReserve), shareAmount, shares.totalSupply()));
    }

    @Override
    public Runnable snapshot() {
        ShareLedger savedShares = shares.copy();
        LockBook savedLocks = locks.copy();
        Duration savedPeriod = minLockUpPeriod;
        BigInteger savedMinimum = depositMinimum;
        BigInteger savedAsset = assetReserve;
        BigInteger savedNative = nativeReserve;
        return () -> {
            shares.restoreFrom(savedShares);
            locks.restoreFrom(savedLocks);
            minLockUpPeriod = savedPeriod;
            depositMinimum = savedMinimum;
            assetReserve = savedAsset;
            nativeReserve = savedNative;
        };
    }
}
