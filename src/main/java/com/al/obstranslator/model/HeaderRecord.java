package com.al.obstranslator.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Metadata cards of one exposure, as read from the primary FITS header.
 *
 * <p>
 * Cards are copied on construction and never change afterwards. The only
 * mutable part is the set of used keys, which grows as translation reads
 * cards and is kept for provenance.
 *
 * <p>
 * Not thread-safe: a record belongs to the translator working on it.
 */
public final class HeaderRecord {

    private final Map<String, Object> cards;
    private final Set<String> usedKeys = new LinkedHashSet<>();

    private HeaderRecord(Map<String, Object> cards) {
        this.cards = Collections.unmodifiableMap(cards);
    }

    /**
     * Copy a header mapping into a new record, preserving key order.
     *
     * @param header raw header cards; values must be strings, numbers or booleans
     * @return the record
     * @throws IllegalArgumentException if a key is null or a value has an
     *                                  unsupported type
     */
    public static HeaderRecord of(Map<String, ?> header) {
        if (header == null) {
            throw new IllegalArgumentException("Header must not be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : header.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            if (key == null) {
                throw new IllegalArgumentException("Header keys must not be null");
            }
            if (value != null && !(value instanceof String || value instanceof Number
                    || value instanceof Boolean)) {
                throw new IllegalArgumentException(String.format(
                        "Unsupported value type %s for header key %s", value.getClass().getSimpleName(), key));
            }
            copy.put(key, value);
        }
        return new HeaderRecord(copy);
    }

    public boolean contains(String key) {
        return cards.containsKey(key);
    }

    /**
     * Raw value of a card. Does not touch the used-keys set.
     */
    public Object get(String key) {
        return cards.get(key);
    }

    public int size() {
        return cards.size();
    }

    public Map<String, Object> asMap() {
        return cards;
    }

    /**
     * Record that the given cards were consulted.
     *
     * @throws IllegalArgumentException if one of the keys is not in this record
     */
    public void markUsed(String... keys) {
        for (String key : keys) {
            if (!cards.containsKey(key)) {
                throw new IllegalArgumentException("Cannot mark absent header key as used: " + key);
            }
        }
        usedKeys.addAll(Arrays.asList(keys));
    }

    public void markUsed(Iterable<String> keys) {
        for (String key : keys) {
            markUsed(key);
        }
    }

    public Set<String> usedKeys() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(usedKeys));
    }

    @Override
    public String toString() {
        return "HeaderRecord" + cards;
    }
}
