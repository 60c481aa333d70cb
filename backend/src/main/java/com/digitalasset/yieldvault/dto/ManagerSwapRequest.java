// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for a manager-directed strategy swap.
 */
public class ManagerSwapRequest {
    @NotBlank
    public String caller;
    @NotBlank
    public String swapper;
    @NotBlank
    public String tokenIn;
    @NotBlank
    public String amountIn;
    @NotBlank
    public String tokenOut;
    @NotBlank
    public String minAmountOut;

    public ManagerSwapRequest() {}
}
