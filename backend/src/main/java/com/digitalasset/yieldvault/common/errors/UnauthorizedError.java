// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class UnauthorizedError extends DomainError {

    public UnauthorizedError(final String details) {
        super("UNAUTHORIZED", details, 403);
    }
}
