// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class SetDefaultSwapperBeforeError extends DomainError {

    public SetDefaultSwapperBeforeError(final String details) {
        super("SET_DEFAULT_SWAPPER_BEFORE", details, 422);
    }
}
