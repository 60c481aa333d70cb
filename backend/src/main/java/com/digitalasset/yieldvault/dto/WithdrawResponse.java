// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

public class WithdrawResponse {
    public String recipient;
    public String sharesBurned;
    public String settlementAsset;
    public String settlementOut;
    public String nativeOut;

    public WithdrawResponse() {}

    public WithdrawResponse(String recipient, String sharesBurned, String settlementAsset, String settlementOut, String nativeOut) {
        this.recipient = recipient;
        this.sharesBurned = sharesBurned;
        this.settlementAsset = settlementAsset;
        this.settlementOut = settlementOut;
        this.nativeOut = nativeOut;
    }
}
