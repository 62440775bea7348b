package com.al.obstranslator.capability;

import lombok.Value;

import java.util.List;

/**
 * Value computed from a header together with the cards that were read to
 * compute it.
 */
@Value
public class CapabilityResult<T> {
    T value;
    List<String> usedKeys;

    public static <T> CapabilityResult<T> of(T value, String... usedKeys) {
        return new CapabilityResult<>(value, List.of(usedKeys));
    }
}
