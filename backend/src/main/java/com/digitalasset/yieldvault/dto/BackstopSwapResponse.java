// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

public class BackstopSwapResponse {
    public String caller;
    public String nativeIn;
    public String asset;
    public String assetOut;
    public String assetReserve;

    public BackstopSwapResponse() {}

    public BackstopSwapResponse(String caller, String nativeIn, String asset, String assetOut, String assetReserve) {
        this.caller = caller;
        this.nativeIn = nativeIn;
        this.asset = asset;
        this.assetOut = assetOut;
        this.assetReserve = assetReserve;
    }
}
