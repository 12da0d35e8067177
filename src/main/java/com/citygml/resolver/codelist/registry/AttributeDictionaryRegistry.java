package com.citygml.resolver.codelist.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.codelist.CodeDictionary;
import com.citygml.resolver.core.AttributeKey;

/**
 * Read-only index of the code dictionaries of one dataset.
 *
 * Dictionaries are registered under their exact (feature, attribute) key and,
 * secondarily, under the attribute alone. {@link #resolve(String, String)} picks
 * the dictionary applicable to a field through an ordered fallback chain:
 * <ol>
 *   <li>exact (feature, attribute)</li>
 *   <li>{@code prefecture}/{@code city} -> (Common, localPublicAuthorities)</li>
 *   <li>composite path {@code a|...|X|y}: (X, y), then (X minus leading feature, y)</li>
 *   <li>first dictionary registered under the attribute alone</li>
 * </ol>
 */
public class AttributeDictionaryRegistry {
    private static final Logger log = LoggerFactory.getLogger(AttributeDictionaryRegistry.class);

    public static final AttributeKey LOCAL_PUBLIC_AUTHORITIES =
            AttributeKey.of("Common", "localPublicAuthorities");

    private static final Set<String> ADMINISTRATIVE_ATTRIBUTES = Set.of("prefecture", "city");
    private static final String PATH_SEPARATOR = "|";

    private final Map<AttributeKey, CodeDictionary> byKey;
    private final Map<String, List<CodeDictionary>> byAttribute;

    private AttributeDictionaryRegistry(Map<AttributeKey, CodeDictionary> byKey,
                                        Map<String, List<CodeDictionary>> byAttribute) {
        this.byKey = Collections.unmodifiableMap(byKey);
        this.byAttribute = Collections.unmodifiableMap(byAttribute);
    }

    public static AttributeDictionaryRegistry empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dictionary applicable to the field, or empty when no rule matches.
     * Never throws for unknown or malformed names.
     */
    public Optional<CodeDictionary> resolve(String feature, String attribute) {
        if (feature == null || attribute == null) {
            return Optional.empty();
        }

        CodeDictionary exact = byKey.get(AttributeKey.of(feature, attribute));
        if (exact != null) {
            return Optional.of(exact);
        }

        if (ADMINISTRATIVE_ATTRIBUTES.contains(attribute)) {
            CodeDictionary authorities = byKey.get(LOCAL_PUBLIC_AUTHORITIES);
            if (authorities != null) {
                return Optional.of(authorities);
            }
            log.debug("No {} codelist registered for administrative attribute {}", LOCAL_PUBLIC_AUTHORITIES, attribute);
        }

        Optional<CodeDictionary> composite = resolveCompositePath(feature, attribute);
        if (composite.isPresent()) {
            return composite;
        }

        List<CodeDictionary> sameAttribute = byAttribute.get(attribute);
        if (sameAttribute != null && !sameAttribute.isEmpty()) {
            return Optional.of(sameAttribute.get(0));
        }
        return Optional.empty();
    }

    /*
     * Nested elements are flattened upstream into paths such as
     * buildingDisasterRiskAttribute|BuildingLandSlideRiskAttribute|description,
     * whose codelist is LandSlideRiskAttribute_description.xml.
     */
    private Optional<CodeDictionary> resolveCompositePath(String feature, String attribute) {
        if (!attribute.contains(PATH_SEPARATOR)) {
            return Optional.empty();
        }
        String[] segments = attribute.split("\\|", -1);
        if (segments.length < 2) {
            return Optional.empty();
        }
        String mayFeature = segments[segments.length - 2];
        String mayAttribute = segments[segments.length - 1];

        CodeDictionary direct = byKey.get(AttributeKey.of(mayFeature, mayAttribute));
        if (direct != null) {
            return Optional.of(direct);
        }

        // Building + LandSlideRiskAttribute = BuildingLandSlideRiskAttribute (unverified convention)
        if (mayFeature.startsWith(feature)) {
            String stripped = mayFeature.substring(feature.length());
            return find(AttributeKey.of(stripped, mayAttribute));
        }
        return Optional.empty();
    }

    public Optional<CodeDictionary> find(AttributeKey key) {
        return Optional.ofNullable(byKey.get(key));
    }

    public List<CodeDictionary> findByAttribute(String attribute) {
        return byAttribute.getOrDefault(attribute, List.of());
    }

    public Set<AttributeKey> keys() {
        return byKey.keySet();
    }

    public int size() {
        return byKey.size();
    }

    public boolean isEmpty() {
        return byKey.isEmpty();
    }

    public static class Builder {
        private final Map<AttributeKey, CodeDictionary> byKey = new LinkedHashMap<>();
        private final Map<String, List<CodeDictionary>> byAttribute = new LinkedHashMap<>();

        public Builder register(String feature, String attribute, CodeDictionary dictionary) {
            return register(AttributeKey.of(feature, attribute), dictionary);
        }

        /**
         * Register a dictionary. For the attribute-only index the first registration wins.
         */
        public Builder register(AttributeKey key, CodeDictionary dictionary) {
            CodeDictionary previous = byKey.put(key, dictionary);
            if (previous != null) {
                log.warn("Codelist {} replaces {} for {}", dictionary.getSource(), previous.getSource(), key);
            }
            byAttribute.computeIfAbsent(key.attribute(), k -> new ArrayList<>()).add(dictionary);
            return this;
        }

        public AttributeDictionaryRegistry build() {
            Map<String, List<CodeDictionary>> frozen = new LinkedHashMap<>();
            byAttribute.forEach((attribute, dictionaries) -> frozen.put(attribute, List.copyOf(dictionaries)));
            return new AttributeDictionaryRegistry(new LinkedHashMap<>(byKey), frozen);
        }
    }
}
