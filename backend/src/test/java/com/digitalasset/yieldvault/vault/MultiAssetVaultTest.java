// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.chain.ChainState;
import com.digitalasset.yieldvault.chain.SettableClock;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.ComeBackLaterError;
import com.digitalasset.yieldvault.config.YieldVaultProperties;
import com.digitalasset.yieldvault.devnet.SimulatedWorld;
import com.digitalasset.yieldvault.strategy.Strategy;
import com.digitalasset.yieldvault.strategy.WithdrawalReceipt;
import com.digitalasset.yieldvault.support.TestWorld;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.digitalasset.yieldvault.util.Amounts.units;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.*;

@DisplayName("Multi-Asset Vault Tests")
class MultiAssetVaultTest {

    private SimulatedWorld world;
    private MultiAssetVault vault;
    private Asset weth;
    private Asset reth;
    private Address alice;
    private Address bob;

    @BeforeEach
    void setUp() {
        world = TestWorld.create();
        vault = world.vault();
        weth = world.settlementAsset();
        reth = TestWorld.asset(world, "rETH");
        alice = TestWorld.account("alice");
        bob = TestWorld.account("bob");
    }

    private DepositReceipt deposit(Address holder, Asset asset, String amount) {
        world.faucet(holder, asset, units(amount));
        return vault.deposit(holder, asset, units(amount), false);
    }

    @Test
    @DisplayName("First deposit mints shares equal to its settlement value")
    void testFirstDeposit() {
        DepositReceipt receipt = deposit(alice, reth, "1");

        assertEquals(units("1.08"), receipt.depositValue());
        assertEquals(units("1.08"), receipt.sharesMinted());
        assertEquals(units("1.08"), vault.totalSupply());
        assertEquals(units("1"), vault.sharePrice());
        assertEquals(TestWorld.GENESIS.plus(Duration.ofDays(1)), receipt.lockedUntil());
    }

    @Test
    @DisplayName("Donations to the strategy do not dilute later depositors")
    void testDonationDoesNotMoveSharePrice() {
        // Arrange
        Address attacker = TestWorld.account("attacker");
        deposit(alice, weth, "0.02");
        world.faucet(attacker, weth, units("100"));
        world.chain().atomicallyRun(() ->
                world.chain().transfer(weth, attacker, world.strategy().address(), units("100")));

        // Act
        DepositReceipt receipt = deposit(bob, weth, "0.02");
        world.advanceTime(Duration.ofDays(1));
        WithdrawalReceipt out = vault.withdraw(bob, receipt.sharesMinted());

        // Assert
        assertEquals(units("0.02"), receipt.sharesMinted());
        assertThat(out.settlementOut()).isCloseTo(units("0.02"), within(units("0.0005")));
        assertEquals(units("0.02"), vault.totalAssets());
    }

    @Test
    @DisplayName("Withdrawal is refused before the lock expires and allowed at the deadline")
    void testLockBoundary() {
        // Arrange
        DepositReceipt receipt = deposit(alice, weth, "1");
        world.advanceTime(Duration.ofDays(1).minusSeconds(1));

        // Act
        DomainException early = assertThrows(DomainException.class,
                () -> vault.withdraw(alice, receipt.sharesMinted()));
        world.advanceTime(Duration.ofSeconds(1));
        WithdrawalReceipt out = vault.withdraw(alice, receipt.sharesMinted());

        // Assert
        assertEquals("COME_BACK_LATER", early.code());
        assertEquals(receipt.lockedUntil(), ((ComeBackLaterError) early.error()).lockedUntil());
        assertEquals(units("1"), out.settlementOut());
        assertEquals(BigInteger.ZERO, vault.totalSupply());
    }

    @Test
    @DisplayName("Every deposit pushes the depositor's lock forward")
    void testLockRefresh() {
        deposit(alice, weth, "1");
        world.advanceTime(Duration.ofHours(12));

        DepositReceipt second = deposit(alice, weth, "1");
        world.advanceTime(Duration.ofHours(12));

        assertEquals(TestWorld.GENESIS.plus(Duration.ofHours(36)), second.lockedUntil());
        assertTrue(vault.isLocked(alice));
        assertEquals("COME_BACK_LATER", assertThrows(DomainException.class,
                () -> vault.withdraw(alice, units("1"))).code());
    }

    @Test
    @DisplayName("Under the pool-wide policy any deposit locks every holder")
    void testPoolWideLock() {
        // Arrange
        YieldVaultProperties props = TestWorld.defaultProperties();
        props.setLockPolicy(LockPolicy.POOL_WIDE);
        world = TestWorld.create(props);
        vault = world.vault();
        deposit(alice, weth, "1");
        world.advanceTime(Duration.ofDays(1));

        // Act
        deposit(bob, weth, "1");

        // Assert
        assertTrue(vault.isLocked(alice));
        assertEquals(LockPolicy.POOL_WIDE, vault.lockPolicy());
    }

    @Test
    @DisplayName("The minimum deposit is inclusive")
    void testMinimumDepositBoundary() {
        world.faucet(alice, weth, units("0.02"));

        DomainException below = assertThrows(DomainException.class,
                () -> vault.deposit(alice, weth, units("0.01").subtract(BigInteger.ONE), false));
        DepositReceipt atMinimum = vault.deposit(alice, weth, units("0.01"), false);

        assertEquals("TOO_SMALL", below.code());
        assertEquals(units("0.01"), atMinimum.sharesMinted());
    }

    @Test
    @DisplayName("Withdrawals need a positive amount the holder actually owns")
    void testWithdrawValidation() {
        deposit(alice, weth, "1");
        world.advanceTime(Duration.ofDays(1));

        assertEquals("TOO_SMALL", assertThrows(DomainException.class,
                () -> vault.withdraw(alice, BigInteger.ZERO)).code());
        assertEquals("INSUFFICIENT_BALANCE", assertThrows(DomainException.class,
                () -> vault.withdraw(alice, units("2"))).code());
        assertEquals("INSUFFICIENT_BALANCE", assertThrows(DomainException.class,
                () -> vault.withdraw(bob, units("1"))).code());
    }

    @Test
    @DisplayName("A recipient rejecting native coin reverts the withdrawal, which can be retried")
    void testFailedNativeSendRollsBack() {
        // Arrange
        DepositReceipt receipt = deposit(alice, reth, "1");
        world.advanceTime(Duration.ofDays(1));
        world.chain().registerReceiver(alice, (from, amount) -> false);

        // Act
        DomainException ex = assertThrows(DomainException.class,
                () -> vault.withdraw(alice, receipt.sharesMinted()));

        // Assert
        assertEquals("FAILED_TO_SEND_ETH", ex.code());
        assertEquals(receipt.sharesMinted(), vault.balanceOf(alice));
        assertEquals(units("1"), world.strategy().reserves(reth));

        world.chain().removeReceiver(alice);
        WithdrawalReceipt out = vault.withdraw(alice, receipt.sharesMinted());
        assertEquals(units("1.08"), out.nativeOut());
    }

    @Test
    @DisplayName("A withdrawal the router cannot pay reverts, then succeeds once the backstop releases native coin")
    void testNativeLiquidityRestoredThroughBackstop() {
        // Arrange
        YieldVaultProperties props = TestWorld.defaultProperties();
        props.getSimulation().setSwapLiquidity(new BigDecimal("1"));
        SimulatedWorld thin = TestWorld.create(props);
        MultiAssetVault thinVault = thin.vault();
        SingleAssetVault backstop = thin.backstop();
        Asset thinReth = TestWorld.asset(thin, "rETH");
        Address router = thin.router().address();
        Address operator = TestWorld.account("operator");
        Address trader = TestWorld.account("trader");

        thin.faucet(operator, thin.settlementAsset(), units("1"));
        backstop.deposit(operator, units("1"));
        thin.faucet(alice, thinReth, units("1"));
        DepositReceipt receipt = thinVault.deposit(alice, thinReth, units("1"), false);
        thin.advanceTime(Duration.ofDays(1));

        // Act
        DomainException ex = assertThrows(DomainException.class,
                () -> thinVault.withdraw(alice, receipt.sharesMinted()));

        // Assert
        assertEquals("INSUFFICIENT_BALANCE", ex.code());
        assertEquals(receipt.sharesMinted(), thinVault.balanceOf(alice));
        assertEquals(receipt.sharesMinted(), thinVault.totalSupply());
        assertEquals(units("1"), thin.strategy().reserves(thinReth));
        assertEquals(units("1"), thin.chain().balanceOf(thinReth, thin.strategy().address()));
        assertEquals(units("1"), thin.chain().balanceOf(Asset.NATIVE, router));
        assertEquals(BigInteger.ZERO, thin.chain().balanceOf(Asset.NATIVE, alice));

        // Native coin swapped into the backstop is redeemed by its depositor and handed to the router
        thin.faucet(trader, Asset.NATIVE, units("1"));
        backstop.swapNativeForAsset(trader, units("1"));
        WithdrawalReceipt released = backstop.withdraw(operator, backstop.balanceOf(operator));
        thin.chain().atomicallyRun(() ->
                thin.chain().transfer(Asset.NATIVE, operator, router, released.nativeOut()));

        WithdrawalReceipt out = thinVault.withdraw(alice, receipt.sharesMinted());
        assertEquals(units("1"), released.nativeOut());
        assertEquals(units("1.08"), out.nativeOut());
        assertEquals(units("1.08"), thin.chain().balanceOf(Asset.NATIVE, alice));
        assertEquals(BigInteger.ZERO, thinVault.totalSupply());
    }

    @Test
    @DisplayName("Total assets and share price never fall across deposits and registry yield")
    void testDepositSequenceIsMonotone() {
        // Arrange
        Address carol = TestWorld.account("carol");
        Asset steth = TestWorld.asset(world, "stETH");
        List<BigInteger> totals = new ArrayList<>();
        List<BigInteger> prices = new ArrayList<>();

        // Act
        deposit(alice, weth, "1");
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        deposit(bob, reth, "2");
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        world.faucet(carol, reth, units("1"));
        vault.deposit(carol, reth, units("1"), true);
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        deposit(carol, steth, "1");
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        world.registry().setExchangeRate(units("1.05"));
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        deposit(bob, weth, "0.3");
        totals.add(vault.totalAssets());
        prices.add(vault.sharePrice());

        // Assert
        assertThat(totals).isSorted();
        assertThat(prices).isSorted();
        assertEquals(units("1"), prices.get(0));
        assertThat(prices.get(prices.size() - 1)).isGreaterThan(units("1"));
        assertThat(totals.get(totals.size() - 1)).isGreaterThan(totals.get(0));
    }

    @Test
    @DisplayName("A receiver calling back into the vault is refused")
    void testReentrantReceiver() {
        // Arrange
        DepositReceipt receipt = deposit(alice, reth, "1");
        world.advanceTime(Duration.ofDays(1));
        AtomicReference<String> callbackError = new AtomicReference<>();
        world.chain().registerReceiver(alice, (from, amount) -> {
            try {
                vault.withdraw(alice, BigInteger.ONE);
            } catch (DomainException e) {
                callbackError.set(e.code());
            }
            return true;
        });

        // Act
        WithdrawalReceipt out = vault.withdraw(alice, receipt.sharesMinted());

        // Assert
        assertEquals("REENTRANT_CALL", callbackError.get());
        assertEquals(units("1.08"), out.nativeOut());
        assertEquals(BigInteger.ZERO, vault.balanceOf(alice));
    }

    @Test
    @DisplayName("Previews follow the current pool")
    void testPreviews() {
        deposit(alice, weth, "1");

        assertEquals(units("1.08"), vault.previewDeposit(reth, units("1")));
        assertEquals(units("0.5"), vault.previewRedeem(units("0.5")));
        assertEquals(BigInteger.ZERO, vault.previewRedeem(BigInteger.ZERO));
    }

    @Test
    @DisplayName("Only the owner changes the lock-up period")
    void testSetMinLockUpPeriod() {
        assertEquals("UNAUTHORIZED", assertThrows(DomainException.class,
                () -> vault.setMinLockUpPeriod(alice, Duration.ZERO)).code());

        vault.setMinLockUpPeriod(world.owner(), Duration.ZERO);
        deposit(alice, weth, "1");

        assertFalse(vault.isLocked(alice));
        assertEquals(Duration.ZERO, vault.minLockUpPeriod());
    }

    @Test
    @DisplayName("A vault without a strategy refuses deposits")
    void testNoStrategy() {
        ChainState chain = new ChainState(new SettableClock(TestWorld.GENESIS));
        MultiAssetVault bare = new MultiAssetVault("bare", chain, world.owner(), LockPolicy.PER_HOLDER, Duration.ZERO);

        DomainException ex = assertThrows(DomainException.class,
                () -> bare.deposit(alice, weth, units("1"), false));

        assertEquals("ZERO_ADDRESS", ex.code());
        assertTrue(bare.strategy().isEmpty());
        assertEquals(BigInteger.ZERO, bare.totalAssets());
    }

    @Test
    @DisplayName("Shares outstanding against a worthless strategy block new deposits")
    void testNoBackingValue() {
        // Arrange
        ChainState chain = new ChainState(new SettableClock(TestWorld.GENESIS));
        MultiAssetVault bare = new MultiAssetVault("bare", chain, world.owner(), LockPolicy.PER_HOLDER, Duration.ZERO);
        Strategy strategy = mock(Strategy.class);
        when(strategy.address()).thenReturn(Address.derive("strategy:mock"));
        when(strategy.totalAssets()).thenReturn(BigInteger.ZERO, units("1"), BigInteger.ZERO);
        bare.setStrategy(world.owner(), strategy);
        chain.atomicallyRun(() -> chain.mint(weth, alice, units("2")));
        bare.deposit(alice, weth, units("1"), false);

        // Act
        DomainException ex = assertThrows(DomainException.class,
                () -> bare.deposit(alice, weth, units("1"), false));

        // Assert
        assertEquals("NO_BACKING_VALUE", ex.code());
        assertEquals(units("1"), bare.totalSupply());
        verify(strategy, times(1)).deposit(any(), any(), any(), anyBoolean());
        assertEquals("NO_BACKING_VALUE", assertThrows(DomainException.class,
                () -> bare.previewDeposit(weth, units("1"))).code());
    }

    @Test
    @DisplayName("Reads work at any time and report the lock deadline")
    void testPositionReads() {
        DepositReceipt receipt = deposit(alice, weth, "1");

        Instant until = vault.lockedUntil(alice).orElseThrow();

        assertEquals(receipt.lockedUntil(), until);
        assertTrue(vault.lockedUntil(bob).isEmpty());
        assertFalse(vault.isLocked(bob));
    }
}
