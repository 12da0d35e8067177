package com.citygml.resolver.frequency;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Label to count table. Counts credited to the same label accumulate.
 */
@ToString
@EqualsAndHashCode
public class ResolvedFrequencyTable {

    private final Map<String, Long> counts = new LinkedHashMap<>();

    public static ResolvedFrequencyTable of(Map<String, ? extends Number> raw) {
        ResolvedFrequencyTable table = new ResolvedFrequencyTable();
        raw.forEach((label, count) -> table.credit(label, count.longValue()));
        return table;
    }

    public void credit(String label, long count) {
        counts.merge(label, count, Long::sum);
    }

    /**
     * Credit the full count to every leaf of the label. A building tagged with
     * both 1 and 2 contributes one occurrence to each.
     */
    public void credit(Label label, long count) {
        for (String leaf : label.leaves()) {
            credit(leaf, count);
        }
    }

    public void mergeFrom(ResolvedFrequencyTable other) {
        other.counts.forEach(this::credit);
    }

    public long get(String label) {
        return counts.getOrDefault(label, 0L);
    }

    public boolean contains(String label) {
        return counts.containsKey(label);
    }

    public Set<String> labels() {
        return Collections.unmodifiableSet(counts.keySet());
    }

    public Map<String, Long> asMap() {
        return Collections.unmodifiableMap(counts);
    }

    public long total() {
        return counts.values().stream().mapToLong(Long::longValue).sum();
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }
}
