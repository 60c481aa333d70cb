// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for a vault deposit. Amounts are decimal strings in asset units.
 */
public class DepositRequest {
    @NotBlank
    public String holder;
    @NotBlank
    public String asset;
    @NotBlank
    public String amount;
    public boolean sellForSettlement;

    public DepositRequest() {}

    public DepositRequest(String holder, String asset, String amount, boolean sellForSettlement) {
        this.holder = holder;
        this.asset = asset;
        this.amount = amount;
        this.sellForSettlement = sellForSettlement;
    }
}
