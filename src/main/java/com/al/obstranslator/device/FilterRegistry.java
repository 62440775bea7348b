package com.al.obstranslator.device;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Filters mounted on the instrument, looked up by physical name or alias.
 */
public class FilterRegistry {

    private final List<FilterDefinition> filters;

    /**
     * @throws IllegalArgumentException if two filters share a physical name
     */
    public FilterRegistry(List<FilterDefinition> filters) {
        Set<String> names = new HashSet<>();
        for (FilterDefinition filter : filters) {
            if (!names.add(filter.getPhysicalFilter())) {
                throw new IllegalArgumentException("Duplicate physical filter: " + filter.getPhysicalFilter());
            }
        }
        this.filters = List.copyOf(filters);
    }

    public List<FilterDefinition> getFilters() {
        return filters;
    }

    public Optional<FilterDefinition> find(String name) {
        return filters.stream().filter(f -> f.matches(name)).findFirst();
    }
}
