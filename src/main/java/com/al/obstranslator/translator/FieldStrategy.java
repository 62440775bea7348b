package com.al.obstranslator.translator;

import com.al.obstranslator.model.ObservationField;
import com.al.obstranslator.model.TrivialMapping;
import com.al.obstranslator.util.HeaderValues;

import java.util.Objects;

/**
 * How one observation field gets its value. Exactly one strategy is bound to
 * each supported field in a {@link FieldResolutionTable}.
 */
public abstract class FieldStrategy {

    public enum Kind {
        TRIVIAL, CONSTANT, COMPUTED
    }

    private FieldStrategy() {
    }

    public abstract Kind kind();

    abstract Object resolve(ObservationField field, ObservationTranslator translator);

    public static FieldStrategy trivial(TrivialMapping mapping) {
        return new Trivial(mapping);
    }

    public static FieldStrategy constant(Object value) {
        return new Constant(value);
    }

    public static FieldStrategy computed(ComputedField function) {
        return new Computed(function);
    }

    /**
     * Value of a single header card, converted with the mapping's unit.
     */
    public static final class Trivial extends FieldStrategy {
        private final TrivialMapping mapping;

        private Trivial(TrivialMapping mapping) {
            this.mapping = Objects.requireNonNull(mapping, "mapping");
        }

        public TrivialMapping getMapping() {
            return mapping;
        }

        @Override
        public Kind kind() {
            return Kind.TRIVIAL;
        }

        @Override
        Object resolve(ObservationField field, ObservationTranslator translator) {
            String key = mapping.getHeaderKey();
            Object raw = translator.useCard(key);
            return HeaderValues.convert(key, raw, mapping.getUnit(), field.getValueType());
        }

        @Override
        public String toString() {
            return "Trivial[" + mapping.getHeaderKey() + "]";
        }
    }

    /**
     * Configured literal; reads no cards.
     */
    public static final class Constant extends FieldStrategy {
        private final Object value;

        private Constant(Object value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public Object getValue() {
            return value;
        }

        @Override
        public Kind kind() {
            return Kind.CONSTANT;
        }

        @Override
        Object resolve(ObservationField field, ObservationTranslator translator) {
            return value;
        }

        @Override
        public String toString() {
            return "Constant[" + value + "]";
        }
    }

    /**
     * Instrument-specific derivation that may read cards, use other fields
     * and call capabilities.
     */
    public static final class Computed extends FieldStrategy {
        private final ComputedField function;

        private Computed(ComputedField function) {
            this.function = Objects.requireNonNull(function, "function");
        }

        @Override
        public Kind kind() {
            return Kind.COMPUTED;
        }

        @Override
        Object resolve(ObservationField field, ObservationTranslator translator) {
            return function.compute(translator);
        }

        @Override
        public String toString() {
            return "Computed";
        }
    }
}
