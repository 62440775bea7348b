package com.al.obstranslator.translator;

import com.al.obstranslator.model.MappingConfiguration;
import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.model.TrivialMapping;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Binds every supported field to one resolution strategy. Computed fields win
 * over trivial mappings, trivial mappings over constants.
 *
 * <p>
 * Immutable and shared by all translators.
 */
@Slf4j
public final class FieldResolutionTable {

    private final Map<ObservationField, FieldStrategy> strategies;

    public FieldResolutionTable(MappingConfiguration mapping, Map<ObservationField, ComputedField> computed) {
        EnumMap<ObservationField, FieldStrategy> table = new EnumMap<>(ObservationField.class);

        computed.forEach((field, function) -> table.put(field, FieldStrategy.computed(function)));

        for (Map.Entry<ObservationField, TrivialMapping> entry : mapping.getTrivial().entrySet()) {
            if (table.containsKey(entry.getKey())) {
                log.warn("Trivial mapping for {} ignored, field is computed", entry.getKey().getConfigKey());
                continue;
            }
            table.put(entry.getKey(), FieldStrategy.trivial(entry.getValue()));
        }

        for (Map.Entry<ObservationField, Object> entry : mapping.getConstant().entrySet()) {
            if (table.containsKey(entry.getKey())) {
                log.warn("Constant for {} ignored, field is resolved by {}", entry.getKey().getConfigKey(),
                        table.get(entry.getKey()));
                continue;
            }
            table.put(entry.getKey(), FieldStrategy.constant(entry.getValue()));
        }

        this.strategies = Collections.unmodifiableMap(table);
        log.info("Field resolution table built: {} fields ({} computed, {} trivial, {} constant)",
                strategies.size(), count(FieldStrategy.Kind.COMPUTED), count(FieldStrategy.Kind.TRIVIAL),
                count(FieldStrategy.Kind.CONSTANT));
    }

    public Optional<FieldStrategy> strategyFor(ObservationField field) {
        return Optional.ofNullable(strategies.get(field));
    }

    /**
     * Supported fields in vocabulary order.
     */
    public Set<ObservationField> supportedFields() {
        return strategies.keySet();
    }

    private long count(FieldStrategy.Kind kind) {
        return strategies.values().stream().filter(s -> s.kind() == kind).count();
    }
}
