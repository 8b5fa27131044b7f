package com.orderline.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only audit trail of resolutions, confirmations and stock effects.
 * Entries are never updated or removed.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} subject={} actor={}",
                entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String subjectId, String actorId) {
        return record(action, subjectId, actorId, null);
    }

    public List<AuditEntry> getAllEntries() {
        return List.copyOf(entries);
    }

    /**
     * Entries about one subject, oldest first.
     */
    public List<AuditEntry> getEntriesFor(String subjectId) {
        return entries.stream()
                .filter(e -> subjectId.equals(e.subjectId()))
                .toList();
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .toList();
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .toList();
    }

    /**
     * Entries with a timestamp in [start, end].
     */
    public List<AuditEntry> getEntriesBetween(Instant start, Instant end) {
        return entries.stream()
                .filter(e -> !e.timestamp().isBefore(start) && !e.timestamp().isAfter(end))
                .toList();
    }

    public int size() {
        return entries.size();
    }

    /**
     * The newest {@code limit} entries, oldest first.
     */
    public List<AuditEntry> getRecentEntries(int limit) {
        List<AuditEntry> snapshot = List.copyOf(entries);
        int size = snapshot.size();
        return size <= limit ? snapshot : snapshot.subList(size - limit, size);
    }
}
