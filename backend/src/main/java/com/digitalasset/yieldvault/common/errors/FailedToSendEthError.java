// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common.errors;

import com.digitalasset.yieldvault.common.DomainError;

public final class FailedToSendEthError extends DomainError {

    public FailedToSendEthError(final String details) {
        super("FAILED_TO_SEND_ETH", details, 409);
    }
}
