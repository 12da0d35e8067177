package com.citygml.resolver.frequency;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.codelist.CodeDictionary;
import com.citygml.resolver.codelist.registry.AttributeDictionaryRegistry;

import lombok.RequiredArgsConstructor;

/**
 * Relabels a raw string-field frequency table with the meanings of its codes.
 *
 * Multi-valued entries credit their full count to each member:
 * <pre>
 * [1]: 2, [1, 2]: 3, [2, 1]: 4, [2]: 1   ->   1: 9, 2: 8
 * </pre>
 */
@RequiredArgsConstructor
public class FrequencyResolver {
    private static final Logger log = LoggerFactory.getLogger(FrequencyResolver.class);

    private final AttributeDictionaryRegistry registry;
    private final BracketValueDecoder decoder;

    public FrequencyResolver(AttributeDictionaryRegistry registry) {
        this(registry, new BracketValueDecoder());
    }

    /**
     * @param layerName     feature type of the layer, e.g. "Building"
     * @param attributeName field name, possibly a {@code |}-delimited path
     * @param rawTable      raw value to count
     * @return the relabelled table, or the raw table unchanged when no codelist applies
     */
    public ResolvedFrequencyTable resolve(String layerName, String attributeName, Map<String, ? extends Number> rawTable) {
        Optional<CodeDictionary> dictionary = registry.resolve(layerName, attributeName);
        if (dictionary.isEmpty()) {
            log.debug("No codelist for {}.{}, keeping raw values", layerName, attributeName);
            return ResolvedFrequencyTable.of(rawTable);
        }

        log.debug("Resolving {}.{} with {}", layerName, attributeName, dictionary.get().getSource());
        ResolvedFrequencyTable resolved = new ResolvedFrequencyTable();
        for (Map.Entry<String, ? extends Number> entry : rawTable.entrySet()) {
            Label label = decoder.decode(dictionary.get(), entry.getKey());
            resolved.credit(label, entry.getValue().longValue());
        }
        return resolved;
    }

    public boolean hasDictionary(String layerName, String attributeName) {
        return registry.resolve(layerName, attributeName).isPresent();
    }
}
