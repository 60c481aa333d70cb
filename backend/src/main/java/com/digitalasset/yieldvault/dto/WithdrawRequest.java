// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for redeeming vault shares.
 */
public class WithdrawRequest {
    @NotBlank
    public String holder;
    @NotBlank
    public String shares;

    public WithdrawRequest() {}

    public WithdrawRequest(String holder, String shares) {
        this.holder = holder;
        this.shares = shares;
    }
}
