package com.citygml.resolver.analysis;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * One layer of a statistics file with field descriptions and resolved frequencies.
 */
@Value
@Builder
public class LayerSummary {
    String source;
    String name;
    long featureCount;
    @Singular
    List<NumericFieldSummary> numericFields;
    @Singular
    List<StringFieldSummary> stringFields;
}
