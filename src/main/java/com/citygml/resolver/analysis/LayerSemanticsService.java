package com.citygml.resolver.analysis;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.citygml.resolver.frequency.FrequencyResolver;
import com.citygml.resolver.frequency.ResolvedFrequencyTable;
import com.citygml.resolver.spec.AttributeSpecTree;
import com.citygml.resolver.stats.GmlStatDocument;
import com.citygml.resolver.stats.LayerFieldStats;
import com.citygml.resolver.stats.NumericFieldStats;

import lombok.RequiredArgsConstructor;

/**
 * Annotates the fields of statistics layers with their specification
 * descriptions and codelist meanings. Numeric statistics pass through unchanged.
 */
@RequiredArgsConstructor
public class LayerSemanticsService {

    private final AttributeSpecTree specTree;
    private final FrequencyResolver frequencyResolver;

    public Optional<String> describeField(String layerName, String fieldName) {
        return specTree.describe(layerName, fieldName);
    }

    public ResolvedFrequencyTable resolveStringField(LayerFieldStats layer, String fieldName) {
        return frequencyResolver.resolve(layer.getName(), fieldName, layer.getStringFrequency(fieldName));
    }

    public List<LayerSummary> summarize(GmlStatDocument document) {
        List<LayerSummary> summaries = new ArrayList<>();
        for (LayerFieldStats layer : document.getLayers()) {
            summaries.add(summarize(document.getSource(), layer));
        }
        return summaries;
    }

    public LayerSummary summarize(String source, LayerFieldStats layer) {
        LayerSummary.LayerSummaryBuilder builder = LayerSummary.builder()
                .source(source)
                .name(layer.getName())
                .featureCount(layer.getFeatureCount());

        for (Map.Entry<String, NumericFieldStats> entry : layer.getNumericFieldStats().entrySet()) {
            builder.numericField(NumericFieldSummary.builder()
                    .name(entry.getKey())
                    .description(describeField(layer.getName(), entry.getKey()).orElse(null))
                    .stats(entry.getValue())
                    .build());
        }

        for (String field : layer.getStringFieldFrequencies().keySet()) {
            builder.stringField(StringFieldSummary.builder()
                    .name(field)
                    .description(describeField(layer.getName(), field).orElse(null))
                    .codelistResolved(frequencyResolver.hasDictionary(layer.getName(), field))
                    .rawFrequencies(layer.getStringFrequency(field))
                    .resolvedFrequencies(resolveStringField(layer, field).asMap())
                    .build());
        }
        return builder.build();
    }
}
