package com.citygml.resolver.dataset;

import com.citygml.resolver.codelist.registry.AttributeDictionaryRegistry;
import com.citygml.resolver.core.context.ResolverDiagnostics;
import com.citygml.resolver.spec.AttributeSpecTree;

import lombok.NonNull;
import lombok.Value;

/**
 * Static reference data of one dataset, built once and shared read-only.
 */
@Value
public class ReferenceData {
    @NonNull
    AttributeDictionaryRegistry registry;
    @NonNull
    AttributeSpecTree specTree;
    @NonNull
    ResolverDiagnostics diagnostics;
}
