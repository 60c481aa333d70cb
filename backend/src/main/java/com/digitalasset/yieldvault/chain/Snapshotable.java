// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

/**
 * State holder that takes part in chain transactions.
 */
@FunctionalInterface
public interface Snapshotable {

    /**
     * Captures the current state.
     *
     * @return action that puts the state back exactly as captured
     */
    Runnable snapshot();
}
