package com.citygml.resolver.stats;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Statistics of one source GML file ({@code *.stat.json}).
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GmlStatDocument {

    /** Path of the GML file the statistics were computed from. */
    private String source;

    private String driver;

    @JsonProperty("layer_count")
    private Integer declaredLayerCount;

    private List<LayerFieldStats> layers = new ArrayList<>();

    public int layerCount() {
        return layers == null ? 0 : layers.size();
    }

    public Optional<LayerFieldStats> findLayer(String name) {
        if (layers == null || name == null) {
            return Optional.empty();
        }
        return layers.stream().filter(layer -> name.equals(layer.getName())).findFirst();
    }
}
