package com.citygml.resolver.analysis;

import com.citygml.resolver.stats.NumericFieldStats;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NumericFieldSummary {
    String name;
    String description;
    NumericFieldStats stats;
}
