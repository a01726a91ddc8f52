package com.soundledger.domain.model.royalty;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only record of split changes. Entries are never removed or replaced.
 */
public final class AuditLog {
    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public void append(AuditEntry entry) {
        entries.add(entry);
    }

    public List<AuditEntry> entries() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }
}
