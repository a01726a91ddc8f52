package com.soundledger.domain.model.royalty;

import com.soundledger.domain.error.OutOfRangeException;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * The revenue-share fractions the royalty engine pays out with, one active entry per artist.
 * <p>
 * Every {@link #set} replaces the artist's entry and appends one {@link AuditEntry} under the same
 * write lock, so the audit trail always ends with the table's current value. Reads and snapshots
 * take the read lock and therefore never see a half-applied change.
 */
public final class ShareTable {
    private final Map<String, ShareEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AuditLog auditLog;
    private final Clock clock;

    public ShareTable(Clock clock) {
        this(clock, new AuditLog());
    }

    public ShareTable(Clock clock, AuditLog auditLog) {
        this.clock = clock;
        this.auditLog = auditLog;
    }

    public Optional<BigDecimal> get(String artist) {
        return entry(artist).map(ShareEntry::getFraction);
    }

    public Optional<ShareEntry> entry(String artist) {
        return read(() -> Optional.ofNullable(entries.get(artist)));
    }

    public AuditEntry set(String artist, BigDecimal fraction, String reason, String actor) {
        return set(artist, fraction, ShareProvenance.AD_HOC, reason, actor);
    }

    public AuditEntry set(String artist,
                          BigDecimal fraction,
                          ShareProvenance provenance,
                          String reason,
                          String actor
    ) {
        requireFraction(artist, fraction);
        var entry = ShareEntry.of(artist, fraction, provenance);

        lock.writeLock().lock();
        try {
            var previous = entries.get(artist);
            var audit = AuditEntry.of(
                    clock.instant(),
                    artist,
                    previous == null ? null : previous.getFraction(),
                    fraction,
                    reason,
                    actor
            );
            entries.put(artist, entry);
            auditLog.append(audit);
            return audit;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Map<String, BigDecimal> snapshot() {
        return read(() -> {
            var copy = new HashMap<String, BigDecimal>(entries.size());
            entries.forEach((artist, entry) -> copy.put(artist, entry.getFraction()));
            return Map.copyOf(copy);
        });
    }

    public List<ShareEntry> entries() {
        return read(() -> entries.values()
                .stream()
                .sorted(Comparator.comparing(ShareEntry::getArtist))
                .toList());
    }

    public List<AuditEntry> auditLog() {
        return auditLog.entries();
    }

    public int size() {
        return read(entries::size);
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    public static void requireFraction(String artist, BigDecimal fraction) {
        if (fraction == null) {
            throw new OutOfRangeException("Share fraction for %s is required".formatted(artist));
        }
        if (fraction.signum() < 0 || fraction.compareTo(BigDecimal.ONE) > 0) {
            throw new OutOfRangeException(
                    "Invalid share fraction %s for %s. Must be between 0 and 1.".formatted(fraction.toPlainString(), artist));
        }
    }
}
