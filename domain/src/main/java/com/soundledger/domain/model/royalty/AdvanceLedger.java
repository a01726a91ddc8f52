package com.soundledger.domain.model.royalty;

import com.soundledger.domain.error.OutOfRangeException;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static java.math.BigDecimal.ZERO;

/**
 * Outstanding advance balance per artist. An artist without an entry has no advance.
 * <p>
 * Payout computation only reads balances; the only way a balance goes down is {@link #settle}.
 */
public final class AdvanceLedger {
    private final Map<String, BigDecimal> balances = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public BigDecimal get(String artist) {
        lock.readLock().lock();
        try {
            return balances.getOrDefault(artist, ZERO);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(String artist, BigDecimal balance) {
        if (balance == null || balance.signum() < 0) {
            throw new OutOfRangeException("Advance balance for %s cannot be negative or empty, got %s"
                    .formatted(artist, balance));
        }

        lock.writeLock().lock();
        try {
            balances.put(artist, balance);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Recovers {@code deducted} from the artist's advance.
     *
     * @return the remaining balance
     */
    public BigDecimal settle(String artist, BigDecimal deducted) {
        if (deducted == null || deducted.signum() < 0) {
            throw new OutOfRangeException("Settled amount for %s cannot be negative or empty, got %s"
                    .formatted(artist, deducted));
        }

        lock.writeLock().lock();
        try {
            var current = balances.getOrDefault(artist, ZERO);
            if (deducted.compareTo(current) > 0) {
                throw new OutOfRangeException("Cannot settle %s against %s's advance of %s"
                        .formatted(deducted.toPlainString(), artist, current.toPlainString()));
            }
            var remaining = current.subtract(deducted);
            if (balances.containsKey(artist) || deducted.signum() != 0) {
                balances.put(artist, remaining);
            }
            return remaining;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Recovers at most {@code requested} from the artist's advance, never more than the balance held
     * at the time of the call.
     *
     * @return the amount actually recovered
     */
    public BigDecimal settleUpTo(String artist, BigDecimal requested) {
        if (requested == null || requested.signum() < 0) {
            throw new OutOfRangeException("Settled amount for %s cannot be negative or empty, got %s"
                    .formatted(artist, requested));
        }

        lock.writeLock().lock();
        try {
            var current = balances.get(artist);
            if (current == null) {
                return ZERO;
            }
            var applied = requested.min(current);
            balances.put(artist, current.subtract(applied));
            return applied;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, BigDecimal> snapshot() {
        lock.readLock().lock();
        try {
            return Map.copyOf(balances);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<AdvanceBalance> balances() {
        return snapshot()
                .entrySet()
                .stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> AdvanceBalance.of(e.getKey(), e.getValue()))
                .toList();
    }
}
