// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

/**
 * Pool-level view of the vault. Values are in settlement-asset units.
 */
public class VaultSummaryResponse {
    public String vault;
    public String strategy;
    public String settlementAsset;
    public String totalAssets;
    public String totalSupply;
    public String sharePrice;
    public String lockPolicy;
    public String lockUpPeriod;

    public VaultSummaryResponse() {}
}
