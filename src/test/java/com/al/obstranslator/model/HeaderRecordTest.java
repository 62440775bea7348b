package com.al.obstranslator.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class HeaderRecordTest {

    @Test
    public void testOf_CopiesCardsInOrder() {
        Map<String, Object> cards = new LinkedHashMap<>();
        cards.put("DATE-OBS", "2021-03-04T12:30:45.678");
        cards.put("EXPTIME", 30);
        cards.put("SIMPLE", true);

        HeaderRecord header = HeaderRecord.of(cards);
        cards.put("FIELD", "M42");

        assertEquals(3, header.size());
        assertFalse(header.contains("FIELD"));
        assertEquals(List.of("DATE-OBS", "EXPTIME", "SIMPLE"), List.copyOf(header.asMap().keySet()));
        assertEquals(30, header.get("EXPTIME"));
    }

    @Test
    public void testOf_RejectsUnsupportedValue() {
        Map<String, Object> cards = Map.of("COMMENT", List.of("a", "b"));

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> HeaderRecord.of(cards));
        assertTrue(ex.getMessage().contains("COMMENT"));
    }

    @Test
    public void testOf_RejectsNullKeyAndNullHeader() {
        Map<String, Object> cards = new HashMap<>();
        cards.put(null, "x");

        assertThrows(IllegalArgumentException.class, () -> HeaderRecord.of(cards));
        assertThrows(IllegalArgumentException.class, () -> HeaderRecord.of(null));
    }

    @Test
    public void testOf_AllowsNullValue() {
        Map<String, Object> cards = new HashMap<>();
        cards.put("OBSERVER", null);

        HeaderRecord header = HeaderRecord.of(cards);

        assertTrue(header.contains("OBSERVER"));
        assertNull(header.get("OBSERVER"));
    }

    @Test
    public void testCardsAreReadOnly() {
        HeaderRecord header = HeaderRecord.of(Map.of("EXPTIME", 30));

        assertThrows(UnsupportedOperationException.class, () -> header.asMap().put("EXPTIME", 60));
    }

    @Test
    public void testMarkUsed() {
        HeaderRecord header = HeaderRecord.of(Map.of("EXPTIME", 30, "IMAGETYP", "Dark Frame"));

        header.markUsed("EXPTIME");
        header.markUsed(List.of("IMAGETYP", "EXPTIME"));

        assertEquals(Set.of("EXPTIME", "IMAGETYP"), header.usedKeys());
    }

    @Test
    public void testMarkUsed_AbsentKey() {
        HeaderRecord header = HeaderRecord.of(Map.of("EXPTIME", 30));

        assertThrows(IllegalArgumentException.class, () -> header.markUsed("DATE-OBS"));
        assertTrue(header.usedKeys().isEmpty());
    }

    @Test
    public void testUsedKeys_IsSnapshot() {
        HeaderRecord header = HeaderRecord.of(Map.of("EXPTIME", 30, "FIELD", "M42"));
        header.markUsed("EXPTIME");

        Set<String> snapshot = header.usedKeys();
        header.markUsed("FIELD");

        assertEquals(Set.of("EXPTIME"), snapshot);
        assertEquals(2, header.usedKeys().size());
    }
}
