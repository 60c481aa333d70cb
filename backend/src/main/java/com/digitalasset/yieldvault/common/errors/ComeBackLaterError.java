// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

import java.time.Instant;

public final class ComeBackLaterError extends DomainError {

    private final Instant lockedUntil;

    public ComeBackLaterError(final String holder, final Instant lockedUntil) {
        super("COME_BACK_LATER", "shares of " + holder + " are locked until " + lockedUntil, 423);
        this.lockedUntil = lockedUntil;
    }

    public Instant lockedUntil() {
        return lockedUntil;
    }
}
