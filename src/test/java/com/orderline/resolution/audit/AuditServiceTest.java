package com.orderline.resolution.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AuditService Tests")
class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Records entries with generated id and timestamp")
    void recordsEntry() {
        AuditEntry entry = auditService.record(AuditAction.LINE_RESOLVED, "line-1", "SYSTEM",
                Map.of("tier", "AUTO"));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals("AUTO", entry.detail("tier"));
        assertEquals(1, auditService.size());
    }

    @Test
    @DisplayName("Details default to an empty map")
    void detailsDefaultEmpty() {
        AuditEntry entry = auditService.record(AuditAction.ORDER_ABORTED, "order-1", "SYSTEM");

        assertTrue(entry.details().isEmpty());
        assertNull(entry.detail("anything"));
    }

    @Test
    @DisplayName("Entries are filtered by subject, action and actor")
    void filters() {
        auditService.record(AuditAction.LINE_RESOLVED, "line-1", "SYSTEM");
        auditService.record(AuditAction.MATCH_CONFIRMED, "line-1", "alice");
        auditService.record(AuditAction.LINE_RESOLVED, "line-2", "SYSTEM");

        assertEquals(2, auditService.getEntriesFor("line-1").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.LINE_RESOLVED).size());
        assertEquals(List.of(AuditAction.MATCH_CONFIRMED),
                auditService.getEntriesByActor("alice").stream().map(AuditEntry::action).toList());
        assertTrue(auditService.getEntriesFor("line-9").isEmpty());
    }

    @Test
    @DisplayName("Time window is inclusive at both ends")
    void entriesBetween() {
        Instant t1 = Instant.parse("2024-06-15T10:00:00Z");
        Instant t2 = Instant.parse("2024-06-15T11:00:00Z");
        Instant t3 = Instant.parse("2024-06-15T12:00:00Z");
        auditService.record(AuditEntry.builder().action(AuditAction.STOCK_SOLD).subjectId("a").timestamp(t1).build());
        auditService.record(AuditEntry.builder().action(AuditAction.STOCK_SOLD).subjectId("b").timestamp(t2).build());
        auditService.record(AuditEntry.builder().action(AuditAction.STOCK_SOLD).subjectId("c").timestamp(t3).build());

        List<String> subjects = auditService.getEntriesBetween(t1, t2).stream().map(AuditEntry::subjectId).toList();
        assertEquals(List.of("a", "b"), subjects);
    }

    @Test
    @DisplayName("Recent entries are the newest, oldest first")
    void recentEntries() {
        for (int i = 0; i < 5; i++) {
            auditService.record(AuditAction.LINE_RESOLVED, "line-" + i, "SYSTEM");
        }

        assertEquals(List.of("line-3", "line-4"),
                auditService.getRecentEntries(2).stream().map(AuditEntry::subjectId).toList());
        assertEquals(5, auditService.getRecentEntries(10).size());
    }

    @Test
    @DisplayName("Returned lists are snapshots")
    void snapshots() {
        auditService.record(AuditAction.LINE_RESOLVED, "line-1", "SYSTEM");
        List<AuditEntry> all = auditService.getAllEntries();

        auditService.record(AuditAction.LINE_RESOLVED, "line-2", "SYSTEM");

        assertEquals(1, all.size());
        assertThrows(UnsupportedOperationException.class, () -> all.add(all.get(0)));
    }

    @Test
    @DisplayName("Entry requires an action")
    void entryRequiresAction() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().subjectId("x").build());
    }
}
