// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;

import java.math.BigInteger;
import java.util.List;

/**
 * What a vault needs from the strategy that custodies its assets.
 *
 * All mutating operations are restricted to the vault the strategy is bound to; the caller is
 * passed explicitly and checked before anything else happens.
 */
public interface Strategy {

    Address address();

    Asset settlementAsset();

    /**
     * Every asset the strategy may hold, in withdrawal order.
     */
    List<Asset> holdingAssets();

    BigInteger reserves(Asset asset);

    /**
     * Settlement-asset value of {@code quantity} of {@code asset} at the current rate.
     */
    BigInteger assetValue(Asset asset, BigInteger quantity);

    /**
     * Sum of {@link #assetValue} over the reserves of all holding assets.
     */
    BigInteger totalAssets();

    /**
     * Accounts for {@code amount} of {@code asset} the vault has already moved to this strategy.
     */
    void deposit(Address caller, Asset asset, BigInteger amount, boolean sellForSettlement);

    /**
     * Pays {@code recipient} the {@code shareAmount / totalSupply} fraction of every holding.
     */
    WithdrawalReceipt withdraw(Address caller, BigInteger shareAmount, BigInteger totalSupply, Address recipient);

    /**
     * Moves every reserve to {@code newStrategy} and zeroes the ledger.
     */
    MigrationManifest migrateFunds(Address caller, Strategy newStrategy);

    /**
     * Books funds received from {@code previousStrategy}.
     */
    void acceptMigration(Address caller, Strategy previousStrategy, MigrationManifest manifest);
}
