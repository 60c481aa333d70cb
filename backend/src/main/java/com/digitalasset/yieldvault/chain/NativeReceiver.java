// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import java.math.BigInteger;

/**
 * Code run when an address receives native coin through {@link ChainState#sendNative}.
 */
@FunctionalInterface
public interface NativeReceiver {

    /**
     * @return false to reject the value; the transfer and everything the receiver did is undone
     */
    boolean onReceive(Address from, BigInteger amount);
}
