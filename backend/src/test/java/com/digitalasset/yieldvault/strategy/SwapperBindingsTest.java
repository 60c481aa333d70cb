// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.strategy;

import com.digitalasset.yieldvault.capability.Swapper;
import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.chain.Asset;
import com.digitalasset.yieldvault.common.DomainException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Swapper Bindings Tests")
class SwapperBindingsTest {

    private static final Asset RETH = Asset.token("rETH");
    private static final Asset WETH = Asset.token("WETH");

    private SwapperBindings bindings;
    private Swapper primary;
    private Swapper backup;

    @BeforeEach
    void setUp() {
        bindings = new SwapperBindings();
        primary = mock(Swapper.class);
        when(primary.address()).thenReturn(Address.derive("swapper:primary"));
        backup = mock(Swapper.class);
        when(backup.address()).thenReturn(Address.derive("swapper:backup"));
    }

    @Test
    @DisplayName("Routes are directed")
    void testRoutesAreDirected() {
        bindings.enable(RETH, WETH, primary);

        assertTrue(bindings.isEnabled(RETH, WETH, primary.address()));
        assertFalse(bindings.isEnabled(WETH, RETH, primary.address()));
        assertTrue(bindings.enabledSwapper(RETH, WETH, primary.address()).isPresent());
        assertTrue(bindings.enabledSwapper(WETH, RETH, primary.address()).isEmpty());
    }

    @Test
    @DisplayName("Only an enabled swapper can become the default")
    void testDefaultMustBeEnabled() {
        DomainException ex = assertThrows(DomainException.class,
                () -> bindings.setDefault(RETH, WETH, primary.address()));

        assertEquals("NOT_SUPPORTED_SWAPPER", ex.code());
        assertTrue(bindings.defaultSwapper(RETH, WETH).isEmpty());
    }

    @Test
    @DisplayName("The default swapper cannot be removed until another default is set")
    void testCannotRemoveDefault() {
        // Arrange
        bindings.enable(RETH, WETH, primary);
        bindings.enable(RETH, WETH, backup);
        bindings.setDefault(RETH, WETH, primary.address());

        // Act
        DomainException ex = assertThrows(DomainException.class,
                () -> bindings.disable(RETH, WETH, primary.address()));
        bindings.setDefault(RETH, WETH, backup.address());
        bindings.disable(RETH, WETH, primary.address());

        // Assert
        assertEquals("SET_DEFAULT_SWAPPER_BEFORE", ex.code());
        assertFalse(bindings.isEnabled(RETH, WETH, primary.address()));
        assertSame(backup, bindings.defaultSwapper(RETH, WETH).orElseThrow());
    }

    @Test
    @DisplayName("Zero-address swappers are rejected")
    void testZeroAddressSwapper() {
        Swapper zero = mock(Swapper.class);
        when(zero.address()).thenReturn(Address.ZERO);

        DomainException ex = assertThrows(DomainException.class, () -> bindings.enable(RETH, WETH, zero));

        assertEquals("ZERO_ADDRESS", ex.code());
    }

    @Test
    @DisplayName("Copies are independent of later changes")
    void testCopyIsIndependent() {
        bindings.enable(RETH, WETH, primary);
        SwapperBindings copy = bindings.copy();

        bindings.enable(RETH, WETH, backup);
        bindings.restoreFrom(copy);

        assertFalse(bindings.isEnabled(RETH, WETH, backup.address()));
        assertTrue(bindings.isEnabled(RETH, WETH, primary.address()));
    }
}
