package com.citygml.resolver.stats;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Summary of a numeric field. min/max/mean are null when the field had no values.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NumericFieldStats {

    private long count;
    private Double min;
    private Double max;
    private Double mean;
    private Histogram histogram = new Histogram();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Histogram {
        @JsonProperty("bin_edges")
        private List<Double> binEdges = new ArrayList<>();
        private List<Long> counts = new ArrayList<>();
    }
}
