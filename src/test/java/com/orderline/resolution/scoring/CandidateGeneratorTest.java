package com.orderline.resolution.scoring;

import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.core.model.CatalogEntry;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.parsing.LineParser;
import com.orderline.resolution.rules.AliasTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CandidateGenerator Tests")
class CandidateGeneratorTest {

    private final LineParser parser = new LineParser();
    private final CandidateGenerator generator = new CandidateGenerator();
    private final CatalogIndex catalog = CatalogIndex.of(List.of(
            entry("p-1", "Tomatoes", "kg"),
            entry("p-2", "Cherry Tomatoes", "punnet"),
            entry("p-3", "Broccoli", "kg"),
            entry("p-4", "Aubergine", "each"),
            entry("p-5", "Sweet Potatoes", "kg"),
            entry("p-6", "Potatoes", "kg")
    ));

    private static CatalogEntry entry(String id, String name, String unit) {
        return CatalogEntry.builder().id(id).canonicalName(name).unit(unit).basePrice("10.00").build();
    }

    private List<String> candidateIds(String raw) {
        ParsedLine line = parser.parse(raw, catalog);
        return generator.generate(line, catalog).stream().map(CatalogEntry::getId).toList();
    }

    @Test
    @DisplayName("Direct containment keeps catalog order")
    void directContainment() {
        assertEquals(List.of("p-1", "p-2"), candidateIds("tomatoes"));
    }

    @Test
    @DisplayName("Alias targets extend the lookup")
    void aliasLookup() {
        assertEquals(List.of("p-4"), candidateIds("2 eggplant"));
    }

    @Test
    @DisplayName("Sound-alike entries are the fallback when nothing contains the words")
    void phoneticFallback() {
        assertEquals(List.of("p-3"), candidateIds("brocoli"));
    }

    @Test
    @DisplayName("Nothing is generated for lines without product words or an empty catalog")
    void emptyInputs() {
        assertTrue(candidateIds("12").isEmpty());
        ParsedLine line = parser.parse("tomatoes", catalog);
        assertTrue(generator.generate(line, CatalogIndex.empty()).isEmpty());
    }

    @Test
    @DisplayName("Unrelated words produce no candidates")
    void unrelatedWords() {
        assertTrue(candidateIds("zzqx").isEmpty());
    }

    @Test
    @DisplayName("Phonetic candidates are capped")
    void phoneticCap() {
        List<CatalogEntry> entries = new ArrayList<>();
        for (int i = 0; i < 15; i++) {
            entries.add(entry("b-" + i, "Broccoli Variety" + (char) ('a' + i), "kg"));
        }
        CatalogIndex many = CatalogIndex.of(entries);
        CandidateGenerator plain = new CandidateGenerator(AliasTable.empty());

        List<CatalogEntry> found = plain.generate(parser.parse("brocoli", many), many);

        assertEquals(CandidateGenerator.MAX_PHONETIC_CANDIDATES, found.size());
    }
}
