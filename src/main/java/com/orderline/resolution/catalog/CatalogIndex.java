package com.orderline.resolution.catalog;

import com.orderline.resolution.core.model.CatalogEntry;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable snapshot of the active catalog with vocabularies derived from its data.
 *
 * <p>Nothing about units or descriptors is hardcoded: the unit vocabulary is whatever
 * the active entries use as units, plus the measure suffixes of numeric descriptors
 * ("g" from "200g"). New catalog entries therefore work without code changes.</p>
 *
 * <p>Instances are built once and never mutated; a rebuilt catalog is published by
 * swapping the whole index in {@link CatalogSnapshotHolder}.</p>
 */
public final class CatalogIndex {

    private static final Pattern NUMBER_WITH_SUFFIX = Pattern.compile("^\\d+(?:\\.\\d+)?([a-z]+)$");
    private static final int MIN_CONTAINMENT_TOKEN_LENGTH = 2;

    private final long version;
    private final List<CatalogEntry> entries;
    private final Map<String, CatalogEntry> byId;
    private final Map<String, String> lowerNames;
    private final Set<String> unitVocabulary;
    private final Set<String> descriptorVocabulary;

    private CatalogIndex(Collection<CatalogEntry> source, long version) {
        this.version = version;
        List<CatalogEntry> active = new ArrayList<>();
        Map<String, CatalogEntry> ids = new LinkedHashMap<>();
        Map<String, String> names = new HashMap<>();
        Map<String, String> seenNames = new HashMap<>();
        Set<String> units = new LinkedHashSet<>();
        Set<String> descriptors = new LinkedHashSet<>();

        for (CatalogEntry entry : source) {
            if (!entry.isActive()) {
                continue;
            }
            String lowerName = entry.getCanonicalName().toLowerCase(Locale.ROOT);
            String previous = seenNames.putIfAbsent(lowerName, entry.getId());
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate active canonical name '"
                        + entry.getCanonicalName() + "' (ids " + previous + ", " + entry.getId() + ")");
            }
            if (ids.putIfAbsent(entry.getId(), entry) != null) {
                throw new IllegalArgumentException("Duplicate catalog entry id: " + entry.getId());
            }
            active.add(entry);
            names.put(entry.getId(), lowerName);
            units.add(entry.getUnit());
            for (String descriptor : entry.getBaseDescriptors()) {
                descriptors.add(descriptor);
                Matcher matcher = NUMBER_WITH_SUFFIX.matcher(descriptor);
                if (matcher.matches()) {
                    units.add(matcher.group(1));
                }
            }
        }

        this.entries = List.copyOf(active);
        this.byId = Collections.unmodifiableMap(ids);
        this.lowerNames = Map.copyOf(names);
        this.unitVocabulary = Collections.unmodifiableSet(units);
        this.descriptorVocabulary = Collections.unmodifiableSet(descriptors);
    }

    /**
     * Builds an index from the given entries; inactive entries are skipped.
     *
     * @throws IllegalArgumentException if two active entries share a canonical name or an id
     */
    public static CatalogIndex of(Collection<CatalogEntry> entries, long version) {
        return new CatalogIndex(entries, version);
    }

    public static CatalogIndex of(Collection<CatalogEntry> entries) {
        return of(entries, 0L);
    }

    public static CatalogIndex empty() {
        return of(List.of(), 0L);
    }

    public long version() {
        return version;
    }

    public List<CatalogEntry> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<CatalogEntry> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Units discovered from the catalog: entry units and the measure suffixes of numeric
     * descriptors ("kg" from "10kg"). A bare descriptor word such as "bag" counts only when
     * it is also some active entry's unit, so "(Soft)" or "(Eggplant)" never become units.
     */
    public Set<String> unitVocabulary() {
        return unitVocabulary;
    }

    public Set<String> descriptorVocabulary() {
        return descriptorVocabulary;
    }

    public boolean isUnit(String token) {
        return token != null && unitVocabulary.contains(token.toLowerCase(Locale.ROOT));
    }

    /**
     * Candidate superset for the given tokens.
     *
     * <p>Each product token is OR-combined as a case-insensitive containment test against
     * canonical names. A unit filter is then applied unless it would leave nothing, and
     * descriptor tokens narrow the set only when at least one candidate carries one of them.</p>
     *
     * @return candidates in catalog order, never null
     */
    public List<CatalogEntry> candidatesFor(Collection<String> productTokens, String unit,
                                            Collection<String> descriptorTokens) {
        List<CatalogEntry> superset = containing(productTokens);
        if (superset.isEmpty()) {
            return superset;
        }

        List<CatalogEntry> result = superset;
        if (unit != null && !unit.isBlank()) {
            String lowerUnit = unit.toLowerCase(Locale.ROOT);
            result = narrow(result, entry -> UnitCompatibility.areCompatible(entry.getUnit(), lowerUnit)
                    || entry.getBaseDescriptors().stream().anyMatch(d -> UnitCompatibility.areCompatible(d, lowerUnit)));
        }
        if (descriptorTokens != null && !descriptorTokens.isEmpty()) {
            Set<String> wanted = lowercase(descriptorTokens);
            result = narrow(result, entry -> entry.getBaseDescriptors().stream().anyMatch(wanted::contains));
        }
        return result;
    }

    /**
     * Entries whose canonical name contains any of the given tokens (case-insensitive).
     */
    public List<CatalogEntry> containing(Collection<String> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }
        Set<String> needles = new LinkedHashSet<>();
        for (String token : tokens) {
            if (token != null && token.length() >= MIN_CONTAINMENT_TOKEN_LENGTH) {
                needles.add(token.toLowerCase(Locale.ROOT));
            }
        }
        if (needles.isEmpty()) {
            return List.of();
        }
        List<CatalogEntry> matches = new ArrayList<>();
        for (CatalogEntry entry : entries) {
            String name = lowerNames.get(entry.getId());
            for (String needle : needles) {
                if (name.contains(needle)) {
                    matches.add(entry);
                    break;
                }
            }
        }
        return matches;
    }

    private static List<CatalogEntry> narrow(List<CatalogEntry> entries, Predicate<CatalogEntry> filter) {
        List<CatalogEntry> filtered = entries.stream().filter(filter).toList();
        return filtered.isEmpty() ? entries : filtered;
    }

    private static Set<String> lowercase(Collection<String> values) {
        Set<String> result = new LinkedHashSet<>();
        for (String value : values) {
            result.add(value.toLowerCase(Locale.ROOT));
        }
        return result;
    }

    @Override
    public String toString() {
        return "CatalogIndex{version=" + version + ", entries=" + entries.size()
                + ", units=" + unitVocabulary + '}';
    }
}
