// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.security;

import com.digitalasset.yieldvault.chain.Address;
import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.UnauthorizedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * CapabilityGuard - Role checks for owner, manager and vault-only operations.
 *
 * Evaluated first in every restricted operation, before any state is read or written.
 */
public final class CapabilityGuard {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityGuard.class);

    private CapabilityGuard() {
    }

    /**
     * Check that the caller holds the role; fails with Unauthorized otherwise
     */
    public static void require(final Address caller, final Address roleHolder, final String role, final String operation) {
        if (caller == null || roleHolder == null || !caller.equals(roleHolder)) {
            logger.warn("{} denied: caller={}, required {}={}", operation, caller, role, roleHolder);
            throw new DomainException(new UnauthorizedError(operation + " is restricted to the " + role));
        }
    }
}
