// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.config;

import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.strategy.MultiAssetStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Startup check of the strategy's routing table.
 *
 * Withdrawals convert every non-settlement holding into native coin through the default
 * swapper, so a holding without a default route to native makes every withdrawal that touches
 * it fail. The check only warns; the application keeps running.
 */
@Component
public class StartupValidation {

    private static final Logger logger = LoggerFactory.getLogger(StartupValidation.class);

    private final MultiAssetStrategy strategy;

    public StartupValidation(final MultiAssetStrategy strategy) {
        this.strategy = strategy;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateRoutes() {
        logger.info("Running startup validation for strategy {}", strategy.address());
        List<Asset> missing = missingNativeRoutes();
        if (missing.isEmpty()) {
            logger.info("All holding assets have a default route to native coin");
            return;
        }
        for (Asset asset : missing) {
            logger.warn("No default swapper for {}->{}: withdrawals holding {} will fail", asset, Asset.NATIVE, asset);
        }
    }

    /**
     * Holding assets that withdrawals would have to swap but cannot.
     */
    public List<Asset> missingNativeRoutes() {
        List<Asset> missing = new ArrayList<>();
        for (Asset asset : strategy.holdingAssets()) {
            if (asset.equals(strategy.settlementAsset()) || asset.equals(strategy.receiptAsset()) || asset.isNative()) {
                continue;
            }
            if (!strategy.hasDefaultSwapper(asset, Asset.NATIVE)) {
                missing.add(asset);
            }
        }
        return missing;
    }
}
