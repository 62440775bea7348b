package com.al.obstranslator.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Declarative part of translation: fields read directly from one header card
 * and fields whose value does not depend on the header at all.
 * Immutable once built.
 */
public final class MappingConfiguration {

    private final Map<ObservationField, TrivialMapping> trivial;
    private final Map<ObservationField, Object> constant;

    /**
     * @throws IllegalArgumentException if a field is both trivial and constant,
     *                                  or a unit does not suit the field's type
     */
    public MappingConfiguration(Map<ObservationField, TrivialMapping> trivial,
            Map<ObservationField, ?> constant) {
        EnumMap<ObservationField, TrivialMapping> trivialCopy = new EnumMap<>(ObservationField.class);
        EnumMap<ObservationField, Object> constantCopy = new EnumMap<>(ObservationField.class);
        if (trivial != null) {
            trivialCopy.putAll(trivial);
        }
        if (constant != null) {
            constantCopy.putAll(constant);
        }

        for (ObservationField field : trivialCopy.keySet()) {
            if (constantCopy.containsKey(field)) {
                throw new IllegalArgumentException(
                        "Field " + field.getConfigKey() + " is mapped both to a header key and to a constant");
            }
            TrivialMapping mapping = trivialCopy.get(field);
            if (mapping.hasUnit() && mapping.getUnit().getCanonicalType() != field.getValueType()) {
                throw new IllegalArgumentException(String.format("Unit %s cannot produce %s for field %s",
                        mapping.getUnit().getSymbol(), field.getValueType().getSimpleName(),
                        field.getConfigKey()));
            }
        }
        for (Map.Entry<ObservationField, Object> entry : constantCopy.entrySet()) {
            ObservationField field = entry.getKey();
            if (!field.getValueType().isInstance(entry.getValue())) {
                throw new IllegalArgumentException(String.format("Constant for field %s must be a %s, got %s",
                        field.getConfigKey(), field.getValueType().getSimpleName(), entry.getValue()));
            }
        }

        this.trivial = Collections.unmodifiableMap(trivialCopy);
        this.constant = Collections.unmodifiableMap(constantCopy);
    }

    public static MappingConfiguration empty() {
        return new MappingConfiguration(Map.of(), Map.of());
    }

    public Map<ObservationField, TrivialMapping> getTrivial() {
        return trivial;
    }

    public Map<ObservationField, Object> getConstant() {
        return constant;
    }
}
