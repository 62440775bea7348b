package com.al.obstranslator.device;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

/**
 * A physical filter and the band it belongs to. Wavelengths are in nm;
 * lambdaMin and lambdaMax are where transmission rises above 1%.
 */
@Value
@Builder
public class FilterDefinition {
    String physicalFilter;
    String band;
    double lambdaEff;
    Double lambdaMin;
    Double lambdaMax;
    @Singular
    Set<String> aliases;

    public boolean matches(String name) {
        return physicalFilter.equals(name) || aliases.contains(name);
    }
}
