// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import org.apache.commons.codec.digest.DigestUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 20-byte account identifier in lower-case hex with a {@code 0x} prefix.
 */
public record Address(String value) {

    private static final Pattern FORMAT = Pattern.compile("^0x[0-9a-f]{40}$");

    public static final Address ZERO = new Address("0x" + "0".repeat(40));

    public Address {
        if (value == null) {
            throw new IllegalArgumentException("address is required");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
        if (!FORMAT.matcher(value).matches()) {
            throw new IllegalArgumentException("malformed address: " + value);
        }
    }

    public static Address of(final String value) {
        return new Address(value);
    }

    /**
     * Deterministic address for a simulated account or contract, e.g. {@code derive("vault")}.
     */
    public static Address derive(final String label) {
        return new Address("0x" + DigestUtils.sha256Hex(label).substring(0, 40));
    }

    public boolean isZero() {
        return equals(ZERO);
    }

    @Override
    public String toString() {
        return value;
    }
}
