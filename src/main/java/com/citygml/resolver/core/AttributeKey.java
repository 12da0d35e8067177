package com.citygml.resolver.core;

import java.util.Objects;

/**
 * A (feature, attribute) pair, e.g. {@code (Building, usage)}.
 */
public record AttributeKey(String feature, String attribute) {

    public AttributeKey {
        Objects.requireNonNull(feature, "feature");
        Objects.requireNonNull(attribute, "attribute");
    }

    public static AttributeKey of(String feature, String attribute) {
        return new AttributeKey(feature, attribute);
    }

    /**
     * Key with both parts stripped of any {@code prefix:} namespace qualifier.
     */
    public static AttributeKey local(String feature, String attribute) {
        return new AttributeKey(LocalNames.localName(feature), LocalNames.localName(attribute));
    }

    @Override
    public String toString() {
        return "(" + feature + ", " + attribute + ")";
    }
}
