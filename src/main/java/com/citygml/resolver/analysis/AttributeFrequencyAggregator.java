package com.citygml.resolver.analysis;

import java.util.Collection;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.frequency.FrequencyResolver;
import com.citygml.resolver.frequency.ResolvedFrequencyTable;
import com.citygml.resolver.stats.GmlStatDocument;
import com.citygml.resolver.stats.LayerFieldStats;

import lombok.RequiredArgsConstructor;

/**
 * Sums the resolved frequencies of one attribute of one layer across many
 * statistics files, e.g. building usage over every tile of a city.
 */
@RequiredArgsConstructor
public class AttributeFrequencyAggregator {
    private static final Logger log = LoggerFactory.getLogger(AttributeFrequencyAggregator.class);

    private final FrequencyResolver frequencyResolver;

    public ResolvedFrequencyTable aggregate(Collection<GmlStatDocument> documents, String targetLayer, String attribute) {
        ResolvedFrequencyTable total = new ResolvedFrequencyTable();
        int layers = 0;
        for (GmlStatDocument document : documents) {
            for (LayerFieldStats layer : document.getLayers()) {
                if (!targetLayer.equals(layer.getName())) {
                    continue;
                }
                total.mergeFrom(frequencyResolver.resolve(layer.getName(), attribute, layer.getStringFrequency(attribute)));
                layers++;
            }
        }
        log.info("Aggregated {}.{} over {} layers: {} labels", targetLayer, attribute, layers, total.size());
        return total;
    }
}
