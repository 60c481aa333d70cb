// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

public class DepositResponse {
    public String holder;
    public String asset;
    public String amount;
    public String depositValue;
    public String sharesMinted;
    public String lockedUntil;

    public DepositResponse() {}

    public DepositResponse(
            String holder,
            String asset,
            String amount,
            String depositValue,
            String sharesMinted,
            String lockedUntil
    ) {
        this.holder = holder;
        this.asset = asset;
        this.amount = amount;
        this.depositValue = depositValue;
        this.sharesMinted = sharesMinted;
        this.lockedUntil = lockedUntil;
    }
}
