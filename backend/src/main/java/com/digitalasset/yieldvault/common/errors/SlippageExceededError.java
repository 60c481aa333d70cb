// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class SlippageExceededError extends DomainError {

    public SlippageExceededError(final String details) {
        super("SLIPPAGE_EXCEEDED", details, 422);
    }
}
