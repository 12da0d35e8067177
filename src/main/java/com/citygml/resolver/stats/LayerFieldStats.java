package com.citygml.resolver.stats;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-layer field statistics: numeric summaries and raw string frequencies.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LayerFieldStats {

    private String name;

    @JsonProperty("feature_count")
    private long featureCount;

    @JsonProperty("spatial_ref_wkt")
    private String spatialRefWkt;

    @JsonProperty("numeric_field_stats")
    private Map<String, NumericFieldStats> numericFieldStats = new LinkedHashMap<>();

    @JsonProperty("string_field_frequencies")
    private Map<String, Map<String, Long>> stringFieldFrequencies = new LinkedHashMap<>();

    public Map<String, Long> getStringFrequency(String field) {
        Map<String, Long> frequency = stringFieldFrequencies == null ? null : stringFieldFrequencies.get(field);
        return frequency == null ? Map.of() : frequency;
    }
}
