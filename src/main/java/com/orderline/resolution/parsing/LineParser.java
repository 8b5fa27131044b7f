package com.orderline.resolution.parsing;

import com.orderline.resolution.catalog.CatalogIndex;
import com.orderline.resolution.core.model.ParsedLine;
import com.orderline.resolution.rules.AliasTable;
import com.orderline.resolution.rules.DefaultCleanupRules;
import com.orderline.resolution.rules.LineCleanupEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizes a raw order line into quantity, unit, product words and descriptor tokens.
 *
 * <p>Rules:</p>
 * <ul>
 *   <li>The first bare number ("2") is the quantity; without one the quantity is 1.</li>
 *   <li>The unit is the first word found in the catalog's unit vocabulary, directly or
 *       through a unit alias ("pkt" → "packet").</li>
 *   <li>Numbers glued to a unit ("200g") are always descriptor tokens, never the quantity.</li>
 *   <li>Everything else that contains letters is a product word.</li>
 * </ul>
 *
 * <p>Parsing never throws; ambiguous input resolves through the defaults above.</p>
 */
public class LineParser {
    private static final Logger log = LoggerFactory.getLogger(LineParser.class);

    private static final Pattern NUMBER_TOKEN = Pattern.compile("^(\\d+(?:\\.\\d+)?)([a-z]*)$");
    private static final Pattern LETTERS = Pattern.compile("\\p{L}");
    private static final Pattern ITEM_SEPARATORS = Pattern.compile("[,;]");

    private final LineCleanupEngine cleanupEngine;
    private final AliasTable aliasTable;

    public LineParser() {
        this(DefaultCleanupRules.createDefaultEngine(), AliasTable.defaults());
    }

    public LineParser(LineCleanupEngine cleanupEngine, AliasTable aliasTable) {
        this.cleanupEngine = cleanupEngine;
        this.aliasTable = aliasTable;
    }

    /**
     * Parses one line using the unit vocabulary of the given catalog snapshot.
     */
    public ParsedLine parse(String rawText, CatalogIndex catalog) {
        return parse(rawText, catalog.unitVocabulary());
    }

    /**
     * Parses one line against an explicit unit vocabulary.
     */
    public ParsedLine parse(String rawText, Set<String> unitVocabulary) {
        if (rawText == null || rawText.isBlank()) {
            return ParsedLine.empty(rawText);
        }

        String cleaned = cleanupEngine.clean(rawText);
        if (cleaned.isEmpty()) {
            return ParsedLine.empty(rawText);
        }
        String[] words = cleaned.split(" ");

        int unitIndex = -1;
        String unit = null;
        for (int i = 0; i < words.length; i++) {
            Optional<String> resolved = resolveUnit(words[i], unitVocabulary);
            if (resolved.isPresent()) {
                unit = resolved.get();
                unitIndex = i;
                break;
            }
        }

        List<NumberToken> bare = new ArrayList<>();
        List<NumberToken> suffixed = new ArrayList<>();
        for (int i = 0; i < words.length; i++) {
            Matcher matcher = NUMBER_TOKEN.matcher(words[i]);
            if (matcher.matches()) {
                NumberToken token = new NumberToken(i, new BigDecimal(matcher.group(1)), matcher.group(2));
                if (token.suffix().isEmpty()) {
                    bare.add(token);
                } else {
                    suffixed.add(token);
                }
            }
        }

        BigDecimal quantity = BigDecimal.ONE;
        Set<String> descriptors = new LinkedHashSet<>();
        Set<Integer> consumed = new LinkedHashSet<>();
        if (unitIndex >= 0) {
            consumed.add(unitIndex);
        }

        if (!bare.isEmpty()) {
            quantity = bare.get(0).value();
            bare.forEach(n -> consumed.add(n.index()));
        }
        for (NumberToken n : suffixed) {
            descriptors.add(words[n.index()]);
            consumed.add(n.index());
        }

        List<String> productTokens = new ArrayList<>();
        for (int i = 0; i < words.length; i++) {
            if (!consumed.contains(i) && LETTERS.matcher(words[i]).find()) {
                productTokens.add(words[i]);
            }
        }

        ParsedLine parsed = ParsedLine.of(rawText, quantity, unit, productTokens, descriptors);
        log.debug("line.parsed raw='{}' quantity={} unit={} product={} descriptors={}",
                rawText, quantity, unit, productTokens, descriptors);
        return parsed;
    }

    /**
     * Splits a multi-line message on newlines, commas and semicolons and parses each item.
     * Blank items are dropped.
     */
    public List<ParsedLine> parseMessage(String message, CatalogIndex catalog) {
        List<ParsedLine> lines = new ArrayList<>();
        for (String item : splitMessage(message)) {
            lines.add(parse(item, catalog));
        }
        return lines;
    }

    /**
     * Splits a message into individual order-line items.
     */
    public static List<String> splitMessage(String message) {
        List<String> items = new ArrayList<>();
        if (message == null) {
            return items;
        }
        for (String line : message.split("\\R")) {
            for (String item : ITEM_SEPARATORS.split(line)) {
                String trimmed = item.trim();
                if (!trimmed.isEmpty()) {
                    items.add(trimmed);
                }
            }
        }
        return items;
    }

    private Optional<String> resolveUnit(String word, Set<String> unitVocabulary) {
        if (unitVocabulary.contains(word)) {
            return Optional.of(word);
        }
        return aliasTable.unitAliasOf(word, unitVocabulary);
    }

    private record NumberToken(int index, BigDecimal value, String suffix) {}
}
