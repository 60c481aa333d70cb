// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.capability.AssetWrapper;
import com.digitalasset.yieldvault.capability.StakingRegistry;
import com.digitalasset.yieldvault.capability.Swapper;
import com.digitalasset.yieldvault.capability.Valuation;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.ReentrancyGuard;
import com.digitalasset.yieldvault.chain.Snapshotable;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.ExceedsDepositCeilingError;
import com.digitalasset.yieldvault.common.errors.FailedToSendEthError;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;
import com.digitalasset.yieldvault.common.errors.InvalidSwapperError;
import com.digitalasset.yieldvault.common.errors.SetDefaultSwapperBeforeError;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import com.digitalasset.yieldvault.common.errors.UnknownAssetError;
import com.digitalasset.yieldvault.common.errors.ValidationError;
import com.digitalasset.yieldvault.common.errors.WithdrawalNotEligibleError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;
import com.digitalasset.yieldvault.security.CapabilityGuard;
import com.digitalasset.yieldvault.util.ShareMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy that holds heterogeneous staking derivatives and stakes the settlement asset in a
 * registry.
 *
 * The reserve ledger is the only source for valuation and proportional withdrawal. Automatic
 * conversions during deposit and withdrawal go through the route's default swapper with no
 * minimum output; only manager swaps carry a caller-chosen minimum.
 */
public class MultiAssetStrategy implements Strategy, Snapshotable {

    private static final Logger logger = LoggerFactory.getLogger(MultiAssetStrategy.class);

    private final Address address;
    private final ChainState chain;
    private final Valuation valuation;
    private final StakingRegistry registry;
    private final Asset settlementAsset;
    private final Asset receiptAsset;
    private final BigInteger dustFloor;
    private final ReentrancyGuard guard;

    private Address owner;
    private Address manager;
    private Address vault;

    private final ReserveLedger reserves = new ReserveLedger();
    private final OrderedAssetSet holdingAssets = new OrderedAssetSet();
    private final OrderedAssetSet underlyingAssets = new OrderedAssetSet();
    private final Map<Asset, UnderlyingAssetConfig> underlyingConfigs = new LinkedHashMap<>();
    private final Map<Asset, AssetWrapper> wrappers = new LinkedHashMap<>();
    private final SwapperBindings swappers = new SwapperBindings();

    public MultiAssetStrategy(
            final String name,
            final ChainState chain,
            final Valuation valuation,
            final StakingRegistry registry,
            final Address owner,
            final BigInteger dustFloor
    ) {
        if (owner == null || owner.isZero()) {
            throw new DomainException(new ZeroAddressError("strategy owner must not be the zero address"));
        }
        this.address = Address.derive("strategy:" + name);
        this.chain = chain;
        this.valuation = valuation;
        this.registry = registry;
        this.settlementAsset = registry.settlementAsset();
        this.receiptAsset = registry.receiptAsset();
        this.dustFloor = dustFloor;
        this.guard = new ReentrancyGuard("strategy:" + name);
        this.owner = owner;
        this.manager = owner;
        this.holdingAssets.add(settlementAsset);
        this.holdingAssets.add(receiptAsset);
        chain.register(this);
    }

    // ========================================
    // READS
    // ========================================

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Asset settlementAsset() {
        return settlementAsset;
    }

    public Asset receiptAsset() {
        return receiptAsset;
    }

    @Override
    public List<Asset> holdingAssets() {
        return holdingAssets.toList();
    }

    public List<Asset> underlyingAssets() {
        return underlyingAssets.toList();
    }

    public Optional<UnderlyingAssetConfig> underlyingConfig(final Asset asset) {
        return Optional.ofNullable(underlyingConfigs.get(asset));
    }

    @Override
    public BigInteger reserves(final Asset asset) {
        return reserves.get(asset);
    }

    /**
     * Reserve ledger in holding order.
     */
    public Map<Asset, BigInteger> reserveSnapshot() {
        Map<Asset, BigInteger> view = new LinkedHashMap<>();
        for (Asset asset : holdingAssets.toList()) {
            view.put(asset, reserves.get(asset));
        }
        return Collections.unmodifiableMap(view);
    }

    @Override
    public BigInteger assetValue(final Asset asset, final BigInteger quantity) {
        if (quantity.signum() == 0) {
            return BigInteger.ZERO;
        }
        if (asset.equals(settlementAsset)) {
            return quantity;
        }
        return valuation.settlementValue(asset, quantity);
    }

    @Override
    public BigInteger totalAssets() {
        BigInteger total = BigInteger.ZERO;
        for (Asset asset : holdingAssets.toList()) {
            total = total.add(assetValue(asset, reserves.get(asset)));
        }
        return total;
    }

    public boolean hasDefaultSwapper(final Asset in, final Asset out) {
        return swappers.defaultSwapper(in, out).isPresent();
    }

    public Address owner() {
        return owner;
    }

    public Address manager() {
        return manager;
    }

    public Address vault() {
        return vault;
    }

    // ========================================
    // VAULT OPERATIONS
    // ========================================

    @Override
    public void deposit(final Address caller, final Asset asset, final BigInteger amount, final boolean sellForSettlement) {
        chain.atomicallyRun(() -> guard.guardedRun("deposit", () -> {
            CapabilityGuard.require(caller, vault, "vault", "deposit");
            doDeposit(asset, amount, sellForSettlement);
        }));
    }

    private void doDeposit(final Asset asset, final BigInteger amount, final boolean sellForSettlement) {
        Asset canonical = asset;
        BigInteger canonicalAmount = amount;
        AssetWrapper wrapper = wrappers.get(asset);
        if (wrapper != null) {
            canonicalAmount = wrapper.wrap(address, amount);
            canonical = wrapper.wrapped();
        }

        BigInteger newReserve = reserves.credit(canonical, canonicalAmount);

        UnderlyingAssetConfig config = underlyingConfigs.get(canonical);
        if (config == null || !underlyingAssets.contains(canonical)) {
            throw new DomainException(new UnknownAssetError(canonical + " is not an accepted underlying asset"));
        }
        if (canonicalAmount.compareTo(config.minDepositAmount()) < 0) {
            throw new DomainException(new TooSmallError(
                    "deposit of " + canonicalAmount + " " + canonical + " is below the minimum " + config.minDepositAmount()));
        }
        if (config.hasCeiling() && newReserve.compareTo(config.depositCeiling()) > 0) {
            throw new DomainException(new ExceedsDepositCeilingError(
                    "reserve of " + canonical + " would be " + newReserve + ", ceiling is " + config.depositCeiling()));
        }

        if (canonical.equals(settlementAsset)) {
            forwardToRegistry(canonicalAmount);
        } else if (sellForSettlement) {
            BigInteger proceeds = swapWithDefault(canonical, canonicalAmount, settlementAsset);
            forwardToRegistry(proceeds);
        }
        logger.debug("Deposited {} {} (as {} {}), sell={}", amount, asset, canonicalAmount, canonical, sellForSettlement);
    }

    @Override
    public WithdrawalReceipt withdraw(
            final Address caller,
            final BigInteger shareAmount,
            final BigInteger totalSupply,
            final Address recipient
    ) {
        return chain.atomically(() -> guard.guarded("withdraw", () -> {
            CapabilityGuard.require(caller, vault, "vault", "withdraw");
            return doWithdraw(shareAmount, totalSupply, recipient);
        }));
    }

    private WithdrawalReceipt doWithdraw(final BigInteger shareAmount, final BigInteger totalSupply, final Address recipient) {
        if (recipient == null || recipient.isZero()) {
            throw new DomainException(new ZeroAddressError("withdrawal recipient must not be the zero address"));
        }
        if (shareAmount.signum() <= 0) {
            throw new DomainException(new TooSmallError("share amount must be positive"));
        }
        if (shareAmount.compareTo(totalSupply) > 0) {
            throw new DomainException(new InsufficientBalanceError(
                    "share amount " + shareAmount + " exceeds total supply " + totalSupply));
        }

        // Shares are priced against the reserves before any conversion credits them.
        Map<Asset, BigInteger> portions = new LinkedHashMap<>();
        for (Asset asset : holdingAssets.toList()) {
            portions.put(asset, ShareMath.proportionalAmount(reserves.get(asset), shareAmount, totalSupply));
        }

        BigInteger settlementOut = BigInteger.ZERO;
        BigInteger nativeOut = BigInteger.ZERO;
        for (Map.Entry<Asset, BigInteger> portion : portions.entrySet()) {
            Asset asset = portion.getKey();
            BigInteger amountToWithdraw = portion.getValue();
            if (amountToWithdraw.signum() == 0) {
                continue;
            }
            if (asset.equals(settlementAsset)) {
                settlementOut = settlementOut.add(amountToWithdraw);
            } else if (asset.equals(receiptAsset)) {
                if (amountToWithdraw.compareTo(dustFloor) < 0) {
                    logger.debug("Leaving {} {} in reserve, below dust floor {}", amountToWithdraw, asset, dustFloor);
                    continue;
                }
                settlementOut = settlementOut.add(redeemReceipts(amountToWithdraw));
            } else if (asset.isNative()) {
                nativeOut = nativeOut.add(amountToWithdraw);
            } else {
                nativeOut = nativeOut.add(swapWithDefault(asset, amountToWithdraw, Asset.NATIVE));
            }
        }

        if (settlementOut.signum() > 0) {
            reserves.debit(settlementAsset, settlementOut);
            chain.transfer(settlementAsset, address, recipient, settlementOut);
        }
        if (nativeOut.signum() > 0) {
            reserves.debit(Asset.NATIVE, nativeOut);
            if (!chain.sendNative(address, recipient, nativeOut)) {
                throw new DomainException(new FailedToSendEthError(recipient + " rejected " + nativeOut + " native coin"));
            }
        }
        logger.debug("Withdrew {}/{} shares for {}: settlement={}, native={}",
                shareAmount, totalSupply, recipient, settlementOut, nativeOut);
        return new WithdrawalReceipt(recipient, settlementOut, nativeOut);
    }

    /**
     * Redeems receipts. The settlement entry is credited with what actually arrived while the
     * receipt entry is debited by the requested amount; the two are not reconciled.
     */
    private BigInteger redeemReceipts(final BigInteger amount) {
        requireRegistryEligible("withdraw");
        BigInteger before = chain.balanceOf(settlementAsset, address);
        registry.withdraw(address, address, amount);
        BigInteger proceeds = chain.balanceOf(settlementAsset, address).subtract(before);
        reserves.credit(settlementAsset, proceeds);
        reserves.debit(receiptAsset, amount);
        return proceeds;
    }

    // ========================================
    // MANAGER SWAPS
    // ========================================

    public BigInteger invokeSwap(
            final Address caller,
            final Address swapper,
            final Asset tokenIn,
            final BigInteger amountIn,
            final Asset tokenOut,
            final BigInteger minAmountOut
    ) {
        return chain.atomically(() -> guard.guarded("invokeSwap", () -> {
            CapabilityGuard.require(caller, manager, "manager", "invokeSwap");
            Swapper bound = swappers.enabledSwapper(tokenIn, tokenOut, swapper)
                    .orElseThrow(() -> new DomainException(new InvalidSwapperError(
                            swapper + " is not enabled for " + tokenIn + "->" + tokenOut)));
            BigInteger received = executeSwap(bound, tokenIn, amountIn, tokenOut, minAmountOut);
            if (tokenOut.equals(settlementAsset)) {
                forwardToRegistry(received);
            }
            logger.info("Manager swap {} {} -> {} {} via {}", amountIn, tokenIn, received, tokenOut, swapper);
            return received;
        }));
    }

    /**
     * Unattended route: default swapper, no minimum output.
     */
    private BigInteger swapWithDefault(final Asset tokenIn, final BigInteger amountIn, final Asset tokenOut) {
        Swapper swapper = swappers.defaultSwapper(tokenIn, tokenOut)
                .orElseThrow(() -> new DomainException(new SetDefaultSwapperBeforeError(
                        "no default swapper for " + tokenIn + "->" + tokenOut)));
        return executeSwap(swapper, tokenIn, amountIn, tokenOut, BigInteger.ZERO);
    }

    private BigInteger executeSwap(
            final Swapper swapper,
            final Asset tokenIn,
            final BigInteger amountIn,
            final Asset tokenOut,
            final BigInteger minAmountOut
    ) {
        if (amountIn.signum() <= 0) {
            throw new DomainException(new TooSmallError("swap amount must be positive"));
        }
        reserves.debit(tokenIn, amountIn);
        BigInteger before = chain.balanceOf(tokenOut, address);
        swapper.swap(address, tokenIn, amountIn, tokenOut, minAmountOut);
        BigInteger received = chain.balanceOf(tokenOut, address).subtract(before);
        reserves.credit(tokenOut, received);
        logger.debug("Swapped {} {} for {} {} via {}", amountIn, tokenIn, received, tokenOut, swapper.address());
        return received;
    }

    private void forwardToRegistry(final BigInteger amount) {
        if (amount.signum() == 0) {
            return;
        }
        reserves.debit(settlementAsset, amount);
        BigInteger before = chain.balanceOf(receiptAsset, address);
        registry.deposit(address, amount);
        BigInteger minted = chain.balanceOf(receiptAsset, address).subtract(before);
        reserves.credit(receiptAsset, minted);
        logger.debug("Staked {} {} for {} {}", amount, settlementAsset, minted, receiptAsset);
    }

    private void requireRegistryEligible(final String operation) {
        if (!registry.isWithdrawEligible(address)) {
            throw new DomainException(new WithdrawalNotEligibleError(
                    "registry does not allow " + operation + " of " + receiptAsset + " for " + address + " yet"));
        }
    }

    // ========================================
    // MIGRATION
    // ========================================

    @Override
    public MigrationManifest migrateFunds(final Address caller, final Strategy newStrategy) {
        return chain.atomically(() -> guard.guarded("migrateFunds", () -> {
            CapabilityGuard.require(caller, vault, "vault", "migrateFunds");
            if (newStrategy == null || newStrategy.address().isZero()) {
                throw new DomainException(new ZeroAddressError("new strategy must not be the zero address"));
            }
            if (newStrategy.address().equals(address)) {
                throw new DomainException(new ValidationError("cannot migrate a strategy into itself"));
            }
            Address target = newStrategy.address();
            Map<Asset, BigInteger> moved = new LinkedHashMap<>();
            moveReserve(settlementAsset, target, moved);
            if (reserves.get(receiptAsset).signum() > 0) {
                requireRegistryEligible("migrateFunds");
                moveReserve(receiptAsset, target, moved);
            }
            for (Asset asset : holdingAssets.toList()) {
                if (!asset.equals(settlementAsset) && !asset.equals(receiptAsset)) {
                    moveReserve(asset, target, moved);
                }
            }
            logger.info("Migrated reserves of {} to {}: {}", address, target, moved);
            return new MigrationManifest(address, target, moved);
        }));
    }

    private void moveReserve(final Asset asset, final Address target, final Map<Asset, BigInteger> moved) {
        BigInteger amount = reserves.drain(asset);
        if (amount.signum() == 0) {
            return;
        }
        chain.transfer(asset, address, target, amount);
        moved.put(asset, amount);
    }

    @Override
    public void acceptMigration(final Address caller, final Strategy previousStrategy, final MigrationManifest manifest) {
        chain.atomicallyRun(() -> guard.guardedRun("acceptMigration", () -> {
            CapabilityGuard.require(caller, vault, "vault", "acceptMigration");
            if (!address.equals(manifest.to())) {
                throw new DomainException(new ValidationError(
                        "manifest is addressed to " + manifest.to() + ", not " + address));
            }
            for (Map.Entry<Asset, BigInteger> entry : manifest.transferred().entrySet()) {
                Asset asset = entry.getKey();
                if (!holdingAssets.contains(asset)) {
                    throw new DomainException(new UnknownAssetError(
                            asset + " received from " + previousStrategy.address() + " is not a holding asset"));
                }
                BigInteger booked = reserves.credit(asset, entry.getValue());
                if (chain.balanceOf(asset, address).compareTo(booked) < 0) {
                    throw new DomainException(new InsufficientBalanceError(
                            "migrated " + asset + " did not arrive at " + address));
                }
            }
            logger.info("Accepted migration from {}: {}", previousStrategy.address(), manifest.transferred());
        }));
    }

    // ========================================
    // ADMINISTRATION (owner-only)
    // ========================================

    public void setManager(final Address caller, final Address newManager) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setManager");
            manager = requireAddress(newManager, "manager");
        });
    }

    public void setVault(final Address caller, final Address newVault) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setVault");
            vault = requireAddress(newVault, "vault");
        });
    }

    public void addUnderlyingAsset(final Address caller, final Asset asset, final UnderlyingAssetConfig config) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "addUnderlyingAsset");
            underlyingAssets.add(asset);
            holdingAssets.add(asset);
            underlyingConfigs.put(asset, config);
            logger.info("Accepting {} (min={}, ceiling={})", asset, config.minDepositAmount(), config.depositCeiling());
        });
    }

    /**
     * Stops accepting deposits of the asset. It stays a holding asset so existing reserves are
     * still valued and paid out.
     */
    public void removeUnderlyingAsset(final Address caller, final Asset asset) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "removeUnderlyingAsset");
            underlyingAssets.remove(asset);
            underlyingConfigs.remove(asset);
        });
    }

    public void setMinDepositAmount(final Address caller, final Asset asset, final BigInteger minimum) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setMinDepositAmount");
            underlyingConfigs.put(asset, requireConfig(asset).withMinDeposit(minimum));
        });
    }

    public void setDepositCeiling(final Address caller, final Asset asset, final BigInteger ceiling) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setDepositCeiling");
            underlyingConfigs.put(asset, requireConfig(asset).withCeiling(ceiling));
        });
    }

    public void addHoldingAsset(final Address caller, final Asset asset) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "addHoldingAsset");
            holdingAssets.add(asset);
        });
    }

    /**
     * Only an empty, non-underlying entry can be dropped; anything else would make reserves
     * disappear from the valuation.
     */
    public void removeHoldingAsset(final Address caller, final Asset asset) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "removeHoldingAsset");
            if (asset.equals(settlementAsset) || asset.equals(receiptAsset) || underlyingAssets.contains(asset)) {
                throw new DomainException(new ValidationError(
                        asset + " is required by the strategy", ValidationError.Type.CONFIGURATION));
            }
            if (reserves.get(asset).signum() > 0) {
                throw new DomainException(new ValidationError(
                        asset + " still has a reserve of " + reserves.get(asset), ValidationError.Type.CONFIGURATION));
            }
            holdingAssets.remove(asset);
        });
    }

    public void registerWrapper(final Address caller, final AssetWrapper wrapper) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "registerWrapper");
            wrappers.put(wrapper.unwrapped(), wrapper);
        });
    }

    public void addSwapper(final Address caller, final Asset tokenIn, final Asset tokenOut, final Swapper swapper) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "addSwapper");
            swappers.enable(tokenIn, tokenOut, swapper);
        });
    }

    public void removeSwapper(final Address caller, final Asset tokenIn, final Asset tokenOut, final Address swapper) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "removeSwapper");
            swappers.disable(tokenIn, tokenOut, swapper);
        });
    }

    public void setDefaultSwapper(final Address caller, final Asset tokenIn, final Asset tokenOut, final Address swapper) {
        chain.atomicallyRun(() -> {
            CapabilityGuard.require(caller, owner, "owner", "setDefaultSwapper");
            swappers.setDefault(tokenIn, tokenOut, swapper);
        });
    }

    private UnderlyingAssetConfig requireConfig(final Asset asset) {
        UnderlyingAssetConfig config = underlyingConfigs.get(asset);
        if (config == null) {
            throw new DomainException(new UnknownAssetError(asset + " is not an accepted underlying asset"));
        }
        return config;
    }

    private static Address requireAddress(final Address address, final String role) {
        if (address == null || address.isZero()) {
            throw new DomainException(new ZeroAddressError(role + " must not be the zero address"));
        }
        return address;
    }

    // ========================================
    // SNAPSHOTS
    // ========================================

    @Override
    public Runnable snapshot() {
        ReserveLedger savedReserves = reserves.copy();
        OrderedAssetSet savedHoldings = holdingAssets.copy();
        OrderedAssetSet savedUnderlyings = underlyingAssets.copy();
        Map<Asset, UnderlyingAssetConfig> savedConfigs = new LinkedHashMap<>(underlyingConfigs);
        Map<Asset, AssetWrapper> savedWrappers = new LinkedHashMap<>(wrappers);
        SwapperBindings savedSwappers = swappers.copy();
        Address savedOwner = owner;
        Address savedManager = manager;
        Address savedVault = vault;
        return () -> {
            reserves.restoreFrom(savedReserves);
            holdingAssets.restoreFrom(savedHoldings);
            underlyingAssets.restoreFrom(savedUnderlyings);
            underlyingConfigs.clear();
            underlyingConfigs.putAll(savedConfigs);
            wrappers.clear();
            wrappers.putAll(savedWrappers);
            swappers.restoreFrom(savedSwappers);
            owner = savedOwner;
            manager = savedManager;
            vault = savedVault;
        };
    }
}
