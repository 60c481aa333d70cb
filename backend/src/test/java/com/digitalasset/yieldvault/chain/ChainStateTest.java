// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.TooSmallError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Chain State Tests")
class ChainStateTest {

    private static final Asset TOKEN = Asset.token("TKN");

    private ChainState chain;
    private Address alice;
    private Address bob;

    @BeforeEach
    void setUp() {
        chain = new ChainState(new SettableClock(Instant.parse("2025-01-01T00:00:00Z")));
        alice = Address.derive("alice");
        bob = Address.derive("bob");
        chain.atomicallyRun(() -> chain.mint(TOKEN, alice, BigInteger.valueOf(100)));
    }

    @Test
    @DisplayName("A failed call restores balances and registered state")
    void testFailedCallRollsBack() {
        // Arrange
        AtomicReference<String> external = new AtomicReference<>("before");
        chain.register(() -> {
            String saved = external.get();
            return () -> external.set(saved);
        });

        // Act
        DomainException ex = assertThrows(DomainException.class, () -> chain.atomicallyRun(() -> {
            chain.transfer(TOKEN, alice, bob, BigInteger.valueOf(40));
            external.set("after");
            throw new DomainException(new TooSmallError("abort"));
        }));

        // Assert
        assertEquals("TOO_SMALL", ex.code());
        assertEquals(BigInteger.valueOf(100), chain.balanceOf(TOKEN, alice));
        assertEquals(BigInteger.ZERO, chain.balanceOf(TOKEN, bob));
        assertEquals("before", external.get());
    }

    @Test
    @DisplayName("A nested failure rolls back the whole outer call")
    void testNestedFailureRollsBackOuterCall() {
        assertThrows(DomainException.class, () -> chain.atomicallyRun(() -> {
            chain.transfer(TOKEN, alice, bob, BigInteger.valueOf(10));
            chain.atomicallyRun(() -> chain.transfer(TOKEN, bob, alice, BigInteger.valueOf(50)));
        }));

        assertEquals(BigInteger.valueOf(100), chain.balanceOf(TOKEN, alice));
        assertEquals(BigInteger.ZERO, chain.balanceOf(TOKEN, bob));
    }

    @Test
    @DisplayName("Overdrawing fails with INSUFFICIENT_BALANCE")
    void testOverdraw() {
        DomainException ex = assertThrows(DomainException.class,
                () -> chain.atomicallyRun(() -> chain.transfer(TOKEN, alice, bob, BigInteger.valueOf(101))));
        assertEquals("INSUFFICIENT_BALANCE", ex.code());
    }

    @Test
    @DisplayName("Transfers to the zero address are rejected")
    void testZeroRecipient() {
        DomainException ex = assertThrows(DomainException.class,
                () -> chain.atomicallyRun(() -> chain.transfer(TOKEN, alice, Address.ZERO, BigInteger.ONE)));
        assertEquals("ZERO_ADDRESS", ex.code());
    }

    @Test
    @DisplayName("Native coin to an address without a receiver always lands")
    void testSendNativeWithoutReceiver() {
        chain.atomicallyRun(() -> chain.mint(Asset.NATIVE, alice, BigInteger.TEN));

        boolean accepted = chain.atomically(() -> chain.sendNative(alice, bob, BigInteger.TEN));

        assertTrue(accepted);
        assertEquals(BigInteger.TEN, chain.balanceOf(Asset.NATIVE, bob));
    }

    @Test
    @DisplayName("A rejecting receiver undoes the transfer and its own effects")
    void testRejectingReceiver() {
        // Arrange
        chain.atomicallyRun(() -> chain.mint(Asset.NATIVE, alice, BigInteger.TEN));
        chain.registerReceiver(bob, (from, amount) -> {
            chain.transfer(TOKEN, alice, bob, BigInteger.ONE);
            return false;
        });

        // Act
        boolean accepted = chain.atomically(() -> chain.sendNative(alice, bob, BigInteger.TEN));

        // Assert
        assertFalse(accepted);
        assertEquals(BigInteger.TEN, chain.balanceOf(Asset.NATIVE, alice));
        assertEquals(BigInteger.ZERO, chain.balanceOf(TOKEN, bob));
    }

    @Test
    @DisplayName("A receiver that fails counts as a rejection")
    void testFailingReceiver() {
        chain.atomicallyRun(() -> chain.mint(Asset.NATIVE, alice, BigInteger.TEN));
        chain.registerReceiver(bob, (from, amount) -> {
            throw new DomainException(new TooSmallError("no thanks"));
        });

        boolean accepted = chain.atomically(() -> chain.sendNative(alice, bob, BigInteger.TEN));

        assertFalse(accepted);
        assertEquals(BigInteger.ZERO, chain.balanceOf(Asset.NATIVE, bob));
    }

    @Test
    @DisplayName("An error escaping a receiver still rolls back the whole call")
    void testErrorRollsBack() {
        // Arrange
        chain.atomicallyRun(() -> chain.mint(Asset.NATIVE, alice, BigInteger.TEN));
        chain.registerReceiver(bob, (from, amount) -> {
            throw new AssertionError("receiver blew up");
        });

        // Act
        assertThrows(AssertionError.class, () -> chain.atomicallyRun(() -> {
            chain.transfer(TOKEN, alice, bob, BigInteger.valueOf(30));
            chain.sendNative(alice, bob, BigInteger.TEN);
        }));

        // Assert
        assertEquals(BigInteger.valueOf(100), chain.balanceOf(TOKEN, alice));
        assertEquals(BigInteger.ZERO, chain.balanceOf(TOKEN, bob));
        assertEquals(BigInteger.TEN, chain.balanceOf(Asset.NATIVE, alice));
        assertEquals(BigInteger.ZERO, chain.balanceOf(Asset.NATIVE, bob));

        chain.removeReceiver(bob);
        chain.atomicallyRun(() -> chain.transfer(TOKEN, alice, bob, BigInteger.ONE));
        assertEquals(BigInteger.ONE, chain.balanceOf(TOKEN, bob));
    }

    @Test
    @DisplayName("Guarded entry points reject nested calls and recover afterwards")
    void testReentrancyGuard() {
        ReentrancyGuard guard = new ReentrancyGuard("demo");

        DomainException ex = assertThrows(DomainException.class,
                () -> guard.guardedRun("outer", () -> guard.guardedRun("inner", () -> { })));

        assertEquals("REENTRANT_CALL", ex.code());
        assertFalse(guard.entered());
        assertEquals(42, guard.guarded("again", () -> 42));
    }
}
