// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class InsufficientBalanceError extends DomainError {

    public InsufficientBalanceError(final String details) {
        super("INSUFFICIENT_BALANCE", details, 409);
    }
}
