// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

public class ReserveDTO {
    public String asset;
    public String address;
    public String quantity;
    public String settlementValue;

    public ReserveDTO() {}

    public ReserveDTO(String asset, String address, String quantity, String settlementValue) {
        this.asset = asset;
        this.address = address;
        this.quantity = quantity;
        this.settlementValue = settlementValue;
    }
}
