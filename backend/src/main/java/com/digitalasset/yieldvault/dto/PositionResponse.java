// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.dto;

/**
 * One holder's shares and what they currently redeem for.
 */
public class PositionResponse {
    public String holder;
    public String shares;
    public String redeemableValue;
    public String lockedUntil;
    public boolean locked;

    public PositionResponse() {}

    public PositionResponse(String holder, String shares, String redeemableValue, String lockedUntil, boolean locked) {
        this.holder = holder;
        this.shares = shares;
        this.redeemableValue = redeemableValue;
        this.lockedUntil = lockedUntil;
        this.locked = locked;
    }
}
