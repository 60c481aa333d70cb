// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

import com.digitalasset.yieldvault.chain.Address;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Earliest redemption instants. A holder that never deposited is unlocked.
 */
public final class LockBook {

    private final LockPolicy policy;
    private final Map<Address, Instant> perHolder = new HashMap<>();
    private Instant poolWide;

    public LockBook(final LockPolicy policy) {
        this.policy = policy;
    }

    public LockPolicy policy() {
        return policy;
    }

    /**
     * Sets the lock to {@code until}. A refresh always overwrites, even with an earlier instant
     * after the lock-up period was shortened.
     */
    public Instant refresh(final Address holder, final Instant until) {
        if (policy == LockPolicy.POOL_WIDE) {
            poolWide = until;
        } else {
            perHolder.put(holder, until);
        }
        return until;
    }

    public Optional<Instant> lockedUntil(final Address holder) {
        if (policy == LockPolicy.POOL_WIDE) {
            return Optional.ofNullable(poolWide);
        }
        return Optional.ofNullable(perHolder.get(holder));
    }

    /**
     * Locked strictly before the deadline; the deadline itself is already unlocked.
     */
    public boolean isLocked(final Address holder, final Instant now) {
        return lockedUntil(holder).map(now::isBefore).orElse(false);
    }

    LockBook copy() {
        LockBook copy = new LockBook(policy);
        copy.restoreFrom(this);
        return copy;
    }

    void restoreFrom(final LockBook other) {
        if (other == this) {
            return;
        }
        perHolder.clear();
        perHolder.putAll(other.perHolder);
        poolWide = other.poolWide;
    }
}
