package com.parley.common.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SettingsValuesTest {

    @Test
    void booleans_acceptCommonSpellings() {
        var values = SettingsValues.of(Map.of("a", true, "b", "yes", "c", "off", "d", 0));
        assertTrue(values.getBoolean("a", false));
        assertTrue(values.getBoolean("b", false));
        assertFalse(values.getBoolean("c", true));
        assertFalse(values.getBoolean("d", true));
    }

    @Test
    void booleans_fallBackOnGarbage() {
        var values = SettingsValues.of(Map.of("a", "maybe"));
        assertTrue(values.getBoolean("a", true));
        assertFalse(values.getBoolean("missing", false));
    }

    @Test
    void ints_parseNumbersAndStrings() {
        var values = SettingsValues.of(Map.of("a", 3, "b", " 7 ", "c", "x"));
        assertEquals(3, values.getInt("a", 0));
        assertEquals(7, values.getInt("b", 0));
        assertEquals(-1, values.getInt("c", -1));
    }

    @Test
    void seconds_rejectNegative() {
        var values = SettingsValues.of(Map.of("a", 90, "b", -5));
        assertEquals(Duration.ofSeconds(90), values.getSeconds("a", Duration.ZERO));
        assertEquals(Duration.ofSeconds(60), values.getSeconds("b", Duration.ofSeconds(60)));
    }

    @Test
    void lists_fromCsvOrCollection() {
        var values = SettingsValues.of(Map.of(
                "csv", " damn, heck ,,",
                "array", List.of("one", " two ")));
        assertEquals(List.of("damn", "heck"), values.getList("csv", List.of()));
        assertEquals(List.of("one", "two"), values.getList("array", List.of()));
        assertEquals(List.of("x"), values.getList("missing", List.of("x")));
    }

    @Test
    void nullValue_countsAsMissing() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("a", null);
        var values = SettingsValues.of(raw);
        assertFalse(values.has("a"));
        assertEquals("fallback", values.getString("a", "fallback"));
    }
}
