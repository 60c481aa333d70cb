// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.config;

import com.digitalasset.yieldvault.chain.AssetDirectory;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.SettableClock;
import com.digitalasset.yieldvault.devnet.SimulatedWorld;
import com.digitalasset.yieldvault.strategy.MultiAssetStrategy;
import com.digitalasset.yieldvault.vault.MultiAssetVault;
import com.digitalasset.yieldvault.vault.SingleAssetVault;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;

/**
 * Exposes the simulated deployment and its contracts as beans.
 */
@Configuration
public class VaultWiringConfig {

    @Bean
    public SettableClock simulationClock() {
        return new SettableClock(Instant.now());
    }

    @Bean
    public SimulatedWorld simulatedWorld(final YieldVaultProperties properties, final SettableClock simulationClock) {
        return SimulatedWorld.build(properties, simulationClock);
    }

    @Bean
    public ChainState chainState(final SimulatedWorld world) {
        return world.chain();
    }

    @Bean
    public AssetDirectory assetDirectory(final SimulatedWorld world) {
        return world.assets();
    }

    @Bean
    public MultiAssetStrategy multiAssetStrategy(final SimulatedWorld world) {
        return world.strategy();
    }

    @Bean
    public MultiAssetVault multiAssetVault(final SimulatedWorld world) {
        return world.vault();
    }

    @Bean
    public SingleAssetVault backstopVault(final SimulatedWorld world) {
        return world.backstop();
    }
}
