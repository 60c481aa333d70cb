// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.common;

import java.util.Objects;

/**
 * Aborts the current chain call. The enclosing transaction restores every state holder
 * to its pre-call snapshot before this reaches the caller.
 */
public class DomainException extends RuntimeException {

    private final DomainError error;

    public DomainException(final DomainError error) {
        super(Objects.requireNonNull(error, "error").toString());
        this.error = error;
    }

    public DomainError error() {
        return error;
    }

    public String code() {
        return error.code();
    }
}
