// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class UnknownAssetError extends DomainError {

    public UnknownAssetError(final String details) {
        super("UNKNOWN_ASSET", details, 400);
    }
}
