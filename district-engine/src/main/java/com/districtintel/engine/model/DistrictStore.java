package com.districtintel.engine.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable district id → entry map. Replaced wholesale on every ingestion cycle,
 * never mutated after construction.
 */
public final class DistrictStore {

    private static final DistrictStore EMPTY = new DistrictStore(Map.of());

    private final Map<String, DistrictEntry> entries;

    public DistrictStore(Map<String, DistrictEntry> entries) {
        this.entries = Collections.unmodifiableMap(new TreeMap<>(entries));
    }

    public static DistrictStore empty() {
        return EMPTY;
    }

    public Optional<DistrictEntry> get(String districtId) {
        if (districtId == null) return Optional.empty();
        return Optional.ofNullable(entries.get(districtId));
    }

    /** Entries in district id order. */
    public Collection<DistrictEntry> entries() {
        return entries.values();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DistrictStore other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "DistrictStore(" + entries.size() + " districts)";
    }
}
