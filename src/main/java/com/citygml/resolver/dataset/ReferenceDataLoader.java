package com.citygml.resolver.dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.codelist.CodeDictionaryParser;
import com.citygml.resolver.codelist.registry.AttributeDictionaryRegistry;
import com.citygml.resolver.codelist.registry.CodelistDiscoveryService;
import com.citygml.resolver.codelist.registry.CodelistRegistryLoader;
import com.citygml.resolver.core.context.ResolverConfig;
import com.citygml.resolver.core.context.ResolverDiagnostics;
import com.citygml.resolver.spec.AttributeSpecTree;
import com.citygml.resolver.spec.AttributeSpecTreeBuilder;
import com.citygml.resolver.spec.parser.SpecificationWorkbookReader;

import lombok.RequiredArgsConstructor;

/**
 * Builds the codelist registry and the specification tree of a dataset.
 *
 * Missing reference data degrades to empty structures with a warning. A
 * workbook with an unexpected layout fails with
 * {@link com.citygml.resolver.spec.SpecificationStructureException}.
 */
@RequiredArgsConstructor
public class ReferenceDataLoader {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private final SpecificationLocator specificationLocator;
    private final SpecificationWorkbookReader workbookReader;

    public ReferenceDataLoader() {
        this(new SpecificationLocator(), new SpecificationWorkbookReader());
    }

    public ReferenceData load(ResolverConfig config) {
        ResolverDiagnostics diagnostics = new ResolverDiagnostics();

        log.info("Loading reference data from {}", config.getDatasetDir());
        CodelistRegistryLoader registryLoader = new CodelistRegistryLoader(
                new CodelistDiscoveryService(),
                new CodeDictionaryParser(config.getFetchTimeout()));
        AttributeDictionaryRegistry registry = registryLoader.load(config.getCodelistDir(), diagnostics);

        AttributeSpecTree specTree = loadSpecTree(config, diagnostics);
        return new ReferenceData(registry, specTree, diagnostics);
    }

    private AttributeSpecTree loadSpecTree(ResolverConfig config, ResolverDiagnostics diagnostics) {
        Optional<Path> workbook = specificationLocator.locate(config.getSpecificationDir(), diagnostics);
        if (workbook.isEmpty()) {
            return AttributeSpecTree.empty();
        }

        log.info("Reading specification: {}", workbook.get().getFileName());
        List<List<String>> rows;
        try {
            rows = workbookReader.read(workbook.get(), config.getSpecificationSheet());
        } catch (IOException e) {
            log.warn("Cannot read specification {}: {}", workbook.get(), e.getMessage());
            diagnostics.getWarnings().add("Cannot read specification " + workbook.get() + ": " + e.getMessage());
            return AttributeSpecTree.empty();
        }
        return AttributeSpecTreeBuilder.fromCells(rows);
    }
}
