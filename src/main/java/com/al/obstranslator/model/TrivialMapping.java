package com.al.obstranslator.model;

import lombok.Value;

/**
 * Direct association between an observation field and one header card,
 * with an optional unit for the card's value.
 */
@Value
public class TrivialMapping {
    String headerKey;
    HeaderUnit unit;

    public static TrivialMapping of(String headerKey) {
        return new TrivialMapping(headerKey, null);
    }

    public static TrivialMapping of(String headerKey, HeaderUnit unit) {
        return new TrivialMapping(headerKey, unit);
    }

    public boolean hasUnit() {
        return unit != null;
    }
}
