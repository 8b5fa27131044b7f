package com.orderline.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LineCleanupEngine Tests")
class LineCleanupEngineTest {

    private LineCleanupEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultCleanupRules.createDefaultEngine();
    }

    @ParameterizedTest
    @CsvSource({
            "'2 x Lemons', '2 lemons'",
            "'2x lemons', '2 lemons'",
            "'x2 lemons', '2 lemons'",
            "'2×lemons', '2 lemons'",
            "'1 * Packet Rosemary 200g', '1 packet rosemary 200g'",
            "'- carrots', 'carrots'",
            "'Rosemary (200g packet)', 'rosemary 200g packet'",
            "'\"Lemons\"!', 'lemons'",
            "'1.5 kg tomatoes.', '1.5 kg tomatoes'"
    })
    @DisplayName("Default rules strip separators and punctuation")
    void defaultRules(String input, String expected) {
        assertEquals(expected, engine.clean(input));
    }

    @Test
    @DisplayName("Letter x inside words survives")
    void letterXInWords() {
        assertEquals("1 box mixed peppers", engine.clean("1 Box Mixed Peppers"));
    }

    @Test
    @DisplayName("Null and blank input yield an empty string")
    void nullAndBlank() {
        assertEquals("", engine.clean(null));
        assertEquals("", engine.clean("   "));
    }

    @Test
    @DisplayName("Rules run in priority order")
    void priorityOrder() {
        LineCleanupEngine custom = new LineCleanupEngine();
        custom.addRule(CleanupRule.builder().name("second").pattern("b").replacement("c").priority(20).build());
        custom.addRule(CleanupRule.builder().name("first").pattern("a").replacement("b").priority(10).build());

        assertEquals("c", custom.clean("a"));
        assertEquals(List.of("first", "second"), custom.getRules().stream().map(CleanupRule::getName).toList());
    }

    @Test
    @DisplayName("Rules can be removed by name")
    void removeRule() {
        assertTrue(engine.removeRule("separator-letter-x"));
        assertFalse(engine.removeRule("separator-letter-x"));
        assertEquals("2 x lemons", engine.clean("2 x Lemons"));
    }

    @Test
    @DisplayName("Builder requires a name and a pattern")
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> CleanupRule.builder().pattern("a").build());
        assertThrows(NullPointerException.class, () -> CleanupRule.builder().name("a").build());
    }
}
