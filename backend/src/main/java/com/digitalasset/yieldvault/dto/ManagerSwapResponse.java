// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

public class ManagerSwapResponse {
    public String swapper;
    public String tokenIn;
    public String amountIn;
    public String tokenOut;
    public String amountOut;

    public ManagerSwapResponse() {}

    public ManagerSwapResponse(String swapper, String tokenIn, String amountIn, String tokenOut, String amountOut) {
        this.swapper = swapper;
        this.tokenIn = tokenIn;
        this.amountIn = amountIn;
        this.tokenOut = tokenOut;
        this.amountOut = amountOut;
    }
}
