// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.vault;

/**
 * Scope of the lock a deposit refreshes.
 */
public enum LockPolicy {
    /** Each depositor waits for its own lock-up period. */
    PER_HOLDER,
    /** Any deposit locks every holder until the pool-wide deadline. */
    POOL_WIDE
}
