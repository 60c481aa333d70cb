// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.devnet;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.AssetDirectory;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.SettableClock;
import com.digitalasset.yieldvault.config.YieldVaultProperties;
import com.digitalasset.yieldvault.constants.VaultConstants;
import com.digitalasset.yieldvault.strategy.MultiAssetStrategy;
import com.digitalasset.yieldvault.strategy.UnderlyingAssetConfig;
import com.digitalasset.yieldvault.util.Amounts;
import com.digitalasset.yieldvault.util.ShareMath;
import com.digitalasset.yieldvault.vault.MultiAssetVault;
import com.digitalasset.yieldvault.vault.SingleAssetVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A complete in-memory deployment: chain, registry, valuation, one router, the strategy, the
 * vault and the single-asset backstop vault, wired and configured from
 * {@link YieldVaultProperties}.
 *
 * Bootstrap order: strategy, vault binding, underlying assets with their wrappers and default
 * routes, router liquidity, then the vault's first strategy.
 */
public final class SimulatedWorld {

    private static final Logger logger = LoggerFactory.getLogger(SimulatedWorld.class);

    private final SettableClock clock;
    private final ChainState chain;
    private final AssetDirectory assets;
    private final Address owner;
    private final Address manager;
    private final Asset settlementAsset;
    private final Asset receiptAsset;
    private final SimulatedStakingRegistry registry;
    private final RateTableValuation valuation;
    private final FixedRateSwapper router;
    private final Map<Asset, RatioWrapper> wrappers = new LinkedHashMap<>();
    private final MultiAssetStrategy strategy;
    private final MultiAssetVault vault;
    private final SingleAssetVault backstop;

    private SimulatedWorld(final YieldVaultProperties props, final SettableClock clock) {
        YieldVaultProperties.Simulation sim = props.getSimulation();
        this.clock = clock;
        this.chain = new ChainState(clock);
        this.assets = new AssetDirectory();
        this.owner = Address.derive(sim.getOwner());
        this.manager = Address.derive(sim.getManager());
        this.settlementAsset = assets.add(Asset.token(sim.getSettlementAsset()));
        this.receiptAsset = assets.add(Asset.token(sim.getReceiptAsset()));

        this.registry = new SimulatedStakingRegistry("main", chain, settlementAsset, receiptAsset);
        registry.setExchangeRate(Amounts.toBaseUnits(sim.getRegistryRate()));
        registry.setCooldown(sim.getRegistryCooldown());

        BigInteger nativeRate = Amounts.toBaseUnits(sim.getNativeRate());
        this.valuation = new RateTableValuation(settlementAsset);
        valuation.trackRate(receiptAsset, registry::exchangeRate);
        valuation.setRate(Asset.NATIVE, nativeRate);

        this.router = new FixedRateSwapper("devnet-router", chain);
        this.strategy = new MultiAssetStrategy("main", chain, valuation, registry, owner, props.getRegistryDustFloor());
        this.vault = new MultiAssetVault("main", chain, owner, props.getLockPolicy(), props.getLockUpPeriod());
        strategy.setManager(owner, manager);
        strategy.setVault(owner, vault.address());

        for (YieldVaultProperties.UnderlyingAsset underlying : sim.getUnderlyingAssets()) {
            configureUnderlying(underlying, nativeRate);
        }

        BigInteger liquidity = Amounts.toBaseUnits(sim.getSwapLiquidity());
        chain.atomicallyRun(() -> {
            chain.mint(settlementAsset, router.address(), liquidity);
            chain.mint(Asset.NATIVE, router.address(), liquidity);
        });

        vault.setStrategy(owner, strategy);
        this.backstop = new SingleAssetVault(
                "backstop", chain, settlementAsset, owner,
                props.getSibling().getLockUpPeriod(),
                Amounts.toBaseUnits(props.getSibling().getDepositMinimum()));

        logger.info("Simulated world ready: vault={}, strategy={}, backstop={}, underlyings={}",
                vault.address(), strategy.address(), backstop.address(), strategy.underlyingAssets());
    }

    public static SimulatedWorld build(final YieldVaultProperties props, final SettableClock clock) {
        return new SimulatedWorld(props, clock);
    }

    private void configureUnderlying(final YieldVaultProperties.UnderlyingAsset underlying, final BigInteger nativeRate) {
        Asset asset = underlying.getSymbol().equalsIgnoreCase(settlementAsset.symbol())
                ? settlementAsset
                : assets.add(Asset.token(underlying.getSymbol()));
        BigInteger rate = Amounts.toBaseUnits(underlying.getRate());

        strategy.addUnderlyingAsset(owner, asset, new UnderlyingAssetConfig(
                Amounts.toBaseUnits(underlying.getMinDeposit()),
                Amounts.toBaseUnits(underlying.getDepositCeiling())));

        if (underlying.getUnwrappedSymbol() != null && !underlying.getUnwrappedSymbol().isBlank()) {
            Asset unwrapped = assets.add(Asset.token(underlying.getUnwrappedSymbol()));
            BigInteger ratio = Amounts.toBaseUnits(underlying.getWrapRatio());
            RatioWrapper wrapper = new RatioWrapper(chain, unwrapped, asset, ratio);
            strategy.registerWrapper(owner, wrapper);
            wrappers.put(unwrapped, wrapper);
            valuation.setRate(unwrapped, ShareMath.applyRate(rate, ratio));
        }

        if (asset.equals(settlementAsset)) {
            return;
        }
        valuation.setRate(asset, rate);
        router.quote(asset, settlementAsset, rate);
        strategy.addSwapper(owner, asset, settlementAsset, router);
        strategy.setDefaultSwapper(owner, asset, settlementAsset, router.address());
        if (underlying.isRouteToNative()) {
            router.quote(asset, Asset.NATIVE, ShareMath.mulDiv(rate, VaultConstants.WAD, nativeRate));
            strategy.addSwapper(owner, asset, Asset.NATIVE, router);
            strategy.setDefaultSwapper(owner, asset, Asset.NATIVE, router.address());
        }
    }

    /**
     * Mints test funds to a holder.
     */
    public void faucet(final Address holder, final Asset asset, final BigInteger amount) {
        chain.atomicallyRun(() -> chain.mint(asset, holder, amount));
        logger.info("Faucet minted {} {} to {}", amount, asset, holder);
    }

    public void advanceTime(final Duration duration) {
        clock.advance(duration);
        logger.info("Clock advanced by {} to {}", duration, clock.instant());
    }

    public SettableClock clock() {
        return clock;
    }

    public ChainState chain() {
        return chain;
    }

    public AssetDirectory assets() {
        return assets;
    }

    public Address owner() {
        return owner;
    }

    public Address manager() {
        return manager;
    }

    public Asset settlementAsset() {
        return settlementAsset;
    }

    public Asset receiptAsset() {
        return receiptAsset;
    }

    public SimulatedStakingRegistry registry() {
        return registry;
    }

    public RateTableValuation valuation() {
        return valuation;
    }

    public FixedRateSwapper router() {
        return router;
    }

    public Map<Asset, RatioWrapper> wrappers() {
        return wrappers;
    }

    public MultiAssetStrategy strategy() {
        return strategy;
    }

    public MultiAssetVault vault() {
        return vault;
    }

    public SingleAssetVault backstop() {
        return backstop;
    }
}
