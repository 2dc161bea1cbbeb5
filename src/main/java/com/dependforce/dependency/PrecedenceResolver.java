package com.dependforce.dependency;

import java.util.*;

/**
 * Collapses duplicate records and orders the survivors so that every object
 * comes after the objects it depends on.
 *
 * An object reachable through several paths keeps only its deepest occurrence:
 * that one carries the strongest ordering constraint.
 */
public class PrecedenceResolver {

    /**
     * @param records enriched records, possibly with duplicates
     * @return one record per dependent identity, ascending by tier
     */
    public List<DependencyRecord> resolve(List<DependencyRecord> records) {
        if (records == null || records.isEmpty()) {
            return new ArrayList<>();
        }

        // first-appearance order keeps ties stable across calls
        Map<ObjectIdentity, DependencyRecord> deepest = new LinkedHashMap<>();
        for (DependencyRecord record : records) {
            deepest.merge(record.getDependentIdentity(), record,
                (kept, candidate) -> candidate.getTier() > kept.getTier() ? candidate : kept);
        }

        List<DependencyRecord> ordered = new ArrayList<>(deepest.values());
        ordered.sort(Comparator.comparingInt(DependencyRecord::getTier));
        return ordered;
    }
}
