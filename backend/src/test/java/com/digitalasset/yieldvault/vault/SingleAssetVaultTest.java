// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.SettableClock;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.strategy.WithdrawalReceipt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

import static com.digitalasset.yieldvault.util.Amounts.units;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Single-Asset Vault Tests")
class SingleAssetVaultTest {

    private static final Asset WETH = Asset.token("WETH");

    private SettableClock clock;
    private ChainState chain;
    private SingleAssetVault vault;
    private Address owner;
    private Address alice;
    private Address bob;

    @BeforeEach
    void setUp() {
        clock = new SettableClock(Instant.parse("2025-01-01T00:00:00Z"));
        chain = new ChainState(clock);
        owner = Address.derive("owner");
        alice = Address.derive("alice");
        bob = Address.derive("bob");
        vault = new SingleAssetVault("backstop", chain, WETH, owner, Duration.ofDays(1), units("0.01"));
        chain.atomicallyRun(() -> {
            chain.mint(WETH, alice, units("10"));
            chain.mint(WETH, bob, units("10"));
            chain.mint(Asset.NATIVE, bob, units("10"));
        });
    }

    @Test
    @DisplayName("Deposits mint shares 1:1 while the pool is at par")
    void testDeposit() {
        DepositReceipt receipt = vault.deposit(alice, units("2"));

        assertEquals(units("2"), receipt.sharesMinted());
        assertEquals(units("2"), vault.assetReserve());
        assertEquals(units("8"), chain.balanceOf(WETH, alice));
        assertTrue(vault.isLocked(alice));
    }

    @Test
    @DisplayName("Deposits below the minimum are rejected")
    void testDepositMinimum() {
        DomainException ex = assertThrows(DomainException.class,
                () -> vault.deposit(alice, units("0.009")));

        assertEquals("TOO_SMALL", ex.code());
        assertEquals(BigInteger.ZERO, vault.totalSupply());
    }

    @Test
    @DisplayName("Native coin is swapped 1:1 for the held asset")
    void testSwapNativeForAsset() {
        // Arrange
        vault.deposit(alice, units("2"));

        // Act
        BigInteger out = vault.swapNativeForAsset(bob, units("0.5"));

        // Assert
        assertEquals(units("0.5"), out);
        assertEquals(units("1.5"), vault.assetReserve());
        assertEquals(units("0.5"), vault.nativeReserve());
        assertEquals(units("2"), vault.totalHeld());
        assertEquals(units("10.5"), chain.balanceOf(WETH, bob));
    }

    @Test
    @DisplayName("A swap larger than the asset reserve is rejected")
    void testSwapBeyondReserve() {
        vault.deposit(alice, units("1"));

        DomainException ex = assertThrows(DomainException.class,
                () -> vault.swapNativeForAsset(bob, units("2")));

        assertEquals("INSUFFICIENT_BALANCE", ex.code());
        assertEquals(units("10"), chain.balanceOf(Asset.NATIVE, bob));
    }

    @Test
    @DisplayName("Withdrawals pay a proportional part of both reserves")
    void testWithdrawProRata() {
        // Arrange
        vault.deposit(alice, units("2"));
        vault.swapNativeForAsset(bob, units("1"));
        clock.advance(Duration.ofDays(1));

        // Act
        WithdrawalReceipt receipt = vault.withdraw(alice, units("1"));

        // Assert
        assertEquals(units("0.5"), receipt.settlementOut());
        assertEquals(units("0.5"), receipt.nativeOut());
        assertEquals(units("0.5"), chain.balanceOf(Asset.NATIVE, alice));
        assertEquals(units("1"), vault.previewRedeem(units("1")));
    }

    @Test
    @DisplayName("Withdrawals respect the lock-up and native-coin rejection")
    void testWithdrawGuards() {
        // Arrange
        vault.deposit(alice, units("2"));
        vault.swapNativeForAsset(bob, units("1"));

        // Act
        DomainException locked = assertThrows(DomainException.class,
                () -> vault.withdraw(alice, units("1")));
        clock.advance(Duration.ofDays(1));
        chain.registerReceiver(alice, (from, amount) -> false);
        DomainException rejected = assertThrows(DomainException.class,
                () -> vault.withdraw(alice, units("1")));

        // Assert
        assertEquals("COME_BACK_LATER", locked.code());
        assertEquals("FAILED_TO_SEND_ETH", rejected.code());
        assertEquals(units("2"), vault.balanceOf(alice));
        assertEquals(units("1"), vault.assetReserve());
    }

    @Test
    @DisplayName("Direct transfers are not counted")
    void testDirectTransferIgnored() {
        vault.deposit(alice, units("1"));
        chain.atomicallyRun(() -> chain.transfer(WETH, bob, vault.address(), units("5")));

        DepositReceipt receipt = vault.deposit(bob, units("1"));

        assertEquals(units("1"), receipt.sharesMinted());
        assertEquals(units("2"), vault.totalHeld());
    }

    @Test
    @DisplayName("Owner-only settings and native-coin configuration are enforced")
    void testConfiguration() {
        assertEquals("UNAUTHORIZED", assertThrows(DomainException.class,
                () -> vault.setDepositMinimum(alice, BigInteger.ZERO)).code());
        assertEquals("VALIDATION_ERROR", assertThrows(DomainException.class,
                () -> new SingleAssetVault("bad", chain, Asset.NATIVE, owner, Duration.ZERO, BigInteger.ONE)).code());

        vault.setDepositMinimum(owner, units("1"));
        vault.setMinLockUpPeriod(owner, Duration.ZERO);

        assertEquals(units("1"), vault.depositMinimum());
        vault.deposit(alice, units("1"));
        assertFalse(vault.isLocked(alice));
    }
}
