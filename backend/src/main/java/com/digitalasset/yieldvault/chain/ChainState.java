// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.digitalasset.yieldvault.chain;

import com.digitalasset.yieldvault.common.DomainException;
import com.digitalasset.yieldvault.common.errors.InsufficientBalanceError;
import com.digitalasset.yieldvault.common.errors.ZeroAddressError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory chain: asset balances per address, native-coin receiver hooks, the clock and the
 * transaction boundary.
 *
 * Calls run one at a time. The outermost {@link #atomically} call snapshots every registered
 * state holder and restores all of them if the call fails, so a failed call leaves no trace.
 * Nested calls join the enclosing transaction.
 */
public class ChainState implements Snapshotable {

    private static final Logger logger = LoggerFactory.getLogger(ChainState.class);

    private final Clock clock;
    private final Map<Asset, Map<Address, BigInteger>> balances = new LinkedHashMap<>();
    private final Map<Address, NativeReceiver> receivers = new HashMap<>();
    private final List<Snapshotable> participants = new ArrayList<>();
    private final ReentrantLock callLock = new ReentrantLock();
    private int depth;

    public ChainState(final Clock clock) {
        this.clock = clock;
        this.participants.add(this);
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Adds a state holder to every future transaction snapshot.
     */
    public void register(final Snapshotable participant) {
        callLock.lock();
        try {
            participants.add(participant);
        } finally {
            callLock.unlock();
        }
    }

    /**
     * Installs code that runs whenever {@code address} receives native coin.
     */
    public void registerReceiver(final Address address, final NativeReceiver receiver) {
        receivers.put(address, receiver);
    }

    public void removeReceiver(final Address address) {
        receivers.remove(address);
    }

    // ========================================
    // TRANSACTIONS
    // ========================================

    /**
     * Runs one chain call. Any exception rolls back every registered state holder.
     */
    public <T> T atomically(final Supplier<T> call) {
        callLock.lock();
        try {
            if (depth > 0) {
                depth++;
                try {
                    return call.get();
                } finally {
                    depth--;
                }
            }
            List<Runnable> restorers = snapshotAll();
            depth++;
            try {
                return call.get();
            } catch (RuntimeException | Error e) {
                restore(restorers);
                logger.debug("Call reverted: {}", e.getMessage());
                throw e;
            } finally {
                depth--;
            }
        } finally {
            callLock.unlock();
        }
    }

    public void atomicallyRun(final Runnable call) {
        atomically(() -> {
            call.run();
            return null;
        });
    }

    /**
     * Serialized read without a snapshot.
     */
    public <T> T read(final Supplier<T> query) {
        callLock.lock();
        try {
            return query.get();
        } finally {
            callLock.unlock();
        }
    }

    // ========================================
    // BALANCES
    // ========================================

    public BigInteger balanceOf(final Asset asset, final Address holder) {
        Map<Address, BigInteger> holders = balances.get(asset);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        return holders.getOrDefault(holder, BigInteger.ZERO);
    }

    public BigInteger totalSupply(final Asset asset) {
        Map<Address, BigInteger> holders = balances.get(asset);
        if (holders == null) {
            return BigInteger.ZERO;
        }
        return holders.values().stream().reduce(BigInteger.ZERO, BigInteger::add);
    }

    public void mint(final Asset asset, final Address to, final BigInteger amount) {
        requireNonZero(to, "mint recipient");
        requireNonNegative(amount);
        credit(asset, to, amount);
    }

    public void burn(final Asset asset, final Address from, final BigInteger amount) {
        requireNonNegative(amount);
        debit(asset, from, amount);
    }

    /**
     * Moves an asset between two addresses. Native coin moved this way runs no receiver code.
     */
    public void transfer(final Asset asset, final Address from, final Address to, final BigInteger amount) {
        requireNonZero(to, "transfer recipient");
        requireNonNegative(amount);
        debit(asset, from, amount);
        credit(asset, to, amount);
    }

    /**
     * Sends native coin and runs the recipient's receiver, if any. A rejecting receiver (returning
     * false or failing) undoes the transfer and everything the receiver did.
     *
     * @return true if the recipient accepted the value
     */
    public boolean sendNative(final Address from, final Address to, final BigInteger amount) {
        requireNonZero(to, "native recipient");
        requireNonNegative(amount);
        NativeReceiver receiver = receivers.get(to);
        if (receiver == null) {
            transfer(Asset.NATIVE, from, to, amount);
            return true;
        }
        List<Runnable> restorers = snapshotAll();
        boolean accepted;
        try {
            transfer(Asset.NATIVE, from, to, amount);
            accepted = receiver.onReceive(from, amount);
        } catch (DomainException e) {
            logger.debug("Native receiver {} failed: {}", to, e.getMessage());
            accepted = false;
        }
        if (!accepted) {
            restore(restorers);
        }
        return accepted;
    }

    private void credit(final Asset asset, final Address to, final BigInteger amount) {
        balances.computeIfAbsent(asset, a -> new LinkedHashMap<>()).merge(to, amount, BigInteger::add);
    }

    private void debit(final Asset asset, final Address from, final BigInteger amount) {
        BigInteger balance = balanceOf(asset, from);
        if (balance.compareTo(amount) < 0) {
            throw new DomainException(new InsufficientBalanceError(
                    from + " holds " + balance + " " + asset + ", needs " + amount));
        }
        balances.computeIfAbsent(asset, a -> new LinkedHashMap<>()).put(from, balance.subtract(amount));
    }

    private static void requireNonZero(final Address address, final String role) {
        if (address == null || address.isZero()) {
            throw new DomainException(new ZeroAddressError(role + " must not be the zero address"));
        }
    }

    private static void requireNonNegative(final BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative, got: " + amount);
        }
    }

    // ========================================
    // SNAPSHOTS
    // ========================================

    @Override
    public Runnable snapshot() {
        Map<Asset, Map<Address, BigInteger>> copy = new LinkedHashMap<>();
        balances.forEach((asset, holders) -> copy.put(asset, new LinkedHashMap<>(holders)));
        return () -> {
            balances.clear();
            copy.forEach((asset, holders) -> balances.put(asset, new LinkedHashMap<>(holders)));
        };
    }

    private List<Runnable> snapshotAll() {
        List<Runnable> restorers = new ArrayList<>(participants.size());
        for (Snapshotable participant : participants) {
            restorers.add(participant.snapshot());
        }
        return restorers;
    }

    private static void restore(final List<Runnable> restorers) {
        restorers.forEach(Runnable::run);
    }
}
