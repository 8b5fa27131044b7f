package com.orderline.resolution.catalog;

import com.orderline.resolution.core.model.CatalogEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CatalogIndex Tests")
class CatalogIndexTest {

    private static CatalogEntry entry(String id, String name, String unit) {
        return CatalogEntry.builder().id(id).canonicalName(name).unit(unit).basePrice("10.00").build();
    }

    private static List<String> ids(List<CatalogEntry> entries) {
        return entries.stream().map(CatalogEntry::getId).toList();
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("Skips inactive entries")
        void skipsInactive() {
            CatalogEntry inactive = CatalogEntry.builder().id("p-2").canonicalName("Old Carrots")
                    .unit("bag").active(false).build();
            CatalogIndex index = CatalogIndex.of(List.of(entry("p-1", "Carrots", "kg"), inactive));

            assertEquals(1, index.size());
            assertTrue(index.findById("p-2").isEmpty());
        }

        @Test
        @DisplayName("Rejects duplicate active canonical names, ignoring case")
        void rejectsDuplicateNames() {
            assertThrows(IllegalArgumentException.class, () -> CatalogIndex.of(List.of(
                    entry("p-1", "Carrots", "kg"),
                    entry("p-2", "carrots", "bag"))));
        }

        @Test
        @DisplayName("Allows an inactive duplicate of an active name")
        void allowsInactiveDuplicate() {
            CatalogEntry inactive = CatalogEntry.builder().id("p-2").canonicalName("Carrots")
                    .unit("bag").active(false).build();
            assertDoesNotThrow(() -> CatalogIndex.of(List.of(entry("p-1", "Carrots", "kg"), inactive)));
        }

        @Test
        @DisplayName("Derives the unit vocabulary from entry units and measure suffixes")
        void unitVocabulary() {
            CatalogIndex index = CatalogIndex.of(List.of(
                    entry("p-1", "Carrots (10kg bag)", "bag"),
                    entry("p-2", "Rosemary (200g packet)", "packet"),
                    entry("p-3", "Strawberries", "punnet")));

            assertEquals(Set.of("bag", "kg", "packet", "g", "punnet"), index.unitVocabulary());
            assertTrue(index.isUnit("KG"));
            assertFalse(index.isUnit("crate"));
        }

        @Test
        @DisplayName("Plain descriptor words are not units")
        void descriptorWordsAreNotUnits() {
            CatalogIndex index = CatalogIndex.of(List.of(
                    entry("p-1", "Brinjals (Eggplant)", "kg"),
                    entry("p-2", "Avocados (Soft)", "each"),
                    entry("p-3", "Carrots (Loose)", "kg")));

            assertEquals(Set.of("kg", "each"), index.unitVocabulary());
            assertFalse(index.isUnit("eggplant"));
            assertFalse(index.isUnit("soft"));
            assertTrue(index.descriptorVocabulary().contains("soft"));
        }

        @Test
        @DisplayName("A packaging word is a unit only when some entry sells in it")
        void packagingWordNeedsEntryUnit() {
            CatalogIndex index = CatalogIndex.of(List.of(
                    entry("p-1", "Carrots (10kg bag)", "kg"),
                    entry("p-2", "Potatoes (Washed)", "bag")));

            assertTrue(index.isUnit("bag"));
            assertTrue(index.isUnit("kg"));
            assertFalse(index.isUnit("washed"));
        }

        @Test
        @DisplayName("Empty index has version 0 and no entries")
        void emptyIndex() {
            CatalogIndex index = CatalogIndex.empty();
            assertTrue(index.isEmpty());
            assertEquals(0L, index.version());
            assertTrue(index.candidatesFor(List.of("carrots"), null, null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Candidate lookup")
    class CandidateLookup {

        private final CatalogIndex index = CatalogIndex.of(List.of(
                entry("p-1", "Carrots (10kg bag)", "bag"),
                entry("p-2", "Carrots (1kg packet)", "packet"),
                entry("p-3", "Baby Carrots", "punnet"),
                entry("p-4", "Tomatoes", "kg")));

        @Test
        @DisplayName("Product tokens are OR-combined containment tests")
        void containmentOr() {
            assertEquals(List.of("p-1", "p-2", "p-3", "p-4"),
                    ids(index.candidatesFor(List.of("carrot", "tomato"), null, null)));
        }

        @Test
        @DisplayName("Unit filter narrows to matching or compatible entries")
        void unitFilter() {
            assertEquals(List.of("p-1", "p-2"), ids(index.candidatesFor(List.of("carrots"), "bag", null)));
        }

        @Test
        @DisplayName("Unit filter is skipped when it would leave nothing")
        void unitFilterSkippedWhenEmpty() {
            assertEquals(List.of("p-1", "p-2", "p-3"), ids(index.candidatesFor(List.of("carrots"), "crate", null)));
        }

        @Test
        @DisplayName("Descriptor tokens narrow only when some candidate carries one")
        void descriptorFilter() {
            assertEquals(List.of("p-1"), ids(index.candidatesFor(List.of("carrots"), null, List.of("10kg"))));
            assertEquals(List.of("p-1", "p-2", "p-3"),
                    ids(index.candidatesFor(List.of("carrots"), null, List.of("25kg"))));
        }

        @Test
        @DisplayName("Single-letter tokens do not match everything")
        void shortTokensIgnored() {
            assertTrue(index.containing(List.of("a")).isEmpty());
        }
    }

    @Nested
    @DisplayName("Snapshot holder")
    class SnapshotHolder {

        @Test
        @DisplayName("Swap publishes a new version and notifies listeners")
        void swapNotifies() {
            CatalogSnapshotHolder holder = CatalogSnapshotHolder.of(List.of(entry("p-1", "Carrots", "kg")));
            AtomicReference<CatalogIndex> seenPrevious = new AtomicReference<>();
            AtomicReference<CatalogIndex> seenCurrent = new AtomicReference<>();
            holder.addListener((previous, current) -> {
                seenPrevious.set(previous);
                seenCurrent.set(current);
            });

            CatalogIndex old = holder.current();
            CatalogIndex next = holder.swap(List.of(entry("p-1", "Carrots", "kg"), entry("p-2", "Leeks", "bunch")));

            assertEquals(old.version() + 1, next.version());
            assertSame(next, holder.current());
            assertSame(old, seenPrevious.get());
            assertSame(next, seenCurrent.get());
        }

        @Test
        @DisplayName("Invalid entries leave the old snapshot in place")
        void invalidSwapKeepsOld() {
            CatalogSnapshotHolder holder = CatalogSnapshotHolder.of(List.of(entry("p-1", "Carrots", "kg")));
            CatalogIndex old = holder.current();

            assertThrows(IllegalArgumentException.class, () -> holder.swap(List.of(
                    entry("p-1", "Carrots", "kg"), entry("p-2", "Carrots", "bag"))));
            assertSame(old, holder.current());
        }

        @Test
        @DisplayName("Readers holding the old snapshot keep seeing it whole")
        void oldSnapshotUnchanged() {
            CatalogSnapshotHolder holder = CatalogSnapshotHolder.of(List.of(entry("p-1", "Carrots", "kg")));
            CatalogIndex reader = holder.current();

            holder.swap(List.of(entry("p-9", "Leeks", "bunch")));

            assertEquals(1, reader.size());
            assertTrue(reader.findById("p-1").isPresent());
            assertTrue(holder.current().findById("p-1").isEmpty());
        }
    }
}
