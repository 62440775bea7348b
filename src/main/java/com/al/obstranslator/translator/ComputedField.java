package com.al.obstranslator.translator;

/**
 * Derivation of one field. Implementations read cards through
 * {@link ObservationTranslator#useCard(String)} or
 * {@link ObservationTranslator#markUsed(Iterable)} and other fields through the
 * translator's accessors, so only the cards read directly are attributed to
 * the field being computed.
 */
@FunctionalInterface
public interface ComputedField {

    Object compute(ObservationTranslator translator);
}
