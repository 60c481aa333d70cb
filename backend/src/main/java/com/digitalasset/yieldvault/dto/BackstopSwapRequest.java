// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import jakarta.validation.constraints.NotBlank;

public class BackstopSwapRequest {
    @NotBlank
    public String caller;
    @NotBlank
    public String amount;

    public BackstopSwapRequest() {}

    public BackstopSwapRequest(String caller, String amount) {
        this.caller = caller;
        this.amount = amount;
    }
}
