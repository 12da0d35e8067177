package com.citygml.resolver.analysis;

import java.util.Map;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class StringFieldSummary {
    String name;
    /** Description from the specification, null when unknown. */
    String description;
    boolean codelistResolved;
    Map<String, Long> rawFrequencies;
    Map<String, Long> resolvedFrequencies;
}
