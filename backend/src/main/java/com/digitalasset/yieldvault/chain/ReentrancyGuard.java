// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.ReentrantCallError;

import java.util.function.Supplier;

/**
 * Call-depth counter shared by all guarded entry points of one contract. A guarded call that
 * starts while another is still running on the same contract is rejected.
 */
public final class ReentrancyGuard {

    private final String contract;
    private int depth;

    public ReentrancyGuard(final String contract) {
        this.contract = contract;
    }

    public <T> T guarded(final String entryPoint, final Supplier<T> body) {
        if (depth > 0) {
            throw new DomainException(new ReentrantCallError(
                    "re-entered " + contract + "." + entryPoint + " while another call is in progress"));
        }
        depth++;
        try {
            return body.get();
        } finally {
            depth--;
        }
    }

    public void guardedRun(final String entryPoint, final Runnable body) {
        guarded(entryPoint, () -> {
            body.run();
            return null;
        });
    }

    public boolean entered() {
        return depth > 0;
    }
}
