// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

import java.util.List;

/**
 * Strategy reserve ledger, in withdrawal order.
 */
public class ReservesResponse {
    public String strategy;
    public String settlementAsset;
    public String totalAssets;
    public List<ReserveDTO> reserves;

    public ReservesResponse() {}

    public ReservesResponse(String strategy, String settlementAsset, String totalAssets, List<ReserveDTO> reserves) {
        this.strategy = strategy;
        this.settlementAsset = settlementAsset;
        this.totalAssets = totalAssets;
        this.reserves = reserves;
    }
}
