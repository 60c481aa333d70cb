// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class InvalidSwapperError extends DomainError {

    public InvalidSwapperError(final String details) {
        super("INVALID_SWAPPER", details, 422);
    }
}
