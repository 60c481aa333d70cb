// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for devnet test funds.
 */
public class FaucetRequest {
    @NotBlank
    public String holder;
    @NotBlank
    public String asset;
    @NotBlank
    public String amount;

    public FaucetRequest() {}

    public FaucetRequest(String holder, String asset, String amount) {
        this.holder = holder;
        this.asset = asset;
        this.amount = amount;
    }
}
