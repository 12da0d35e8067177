package com.citygml.resolver.dataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.core.context.ResolverDiagnostics;

/**
 * Locates the single specification workbook of a dataset.
 */
public class SpecificationLocator {
    private static final Logger log = LoggerFactory.getLogger(SpecificationLocator.class);

    /**
     * The only {@code *.xlsx} directly under {@code specificationDir}; empty when
     * the directory is missing or holds zero or several workbooks.
     */
    public Optional<Path> locate(Path specificationDir, ResolverDiagnostics diagnostics) {
        if (!Files.isDirectory(specificationDir)) {
            warn(diagnostics, "Specification directory not found: " + specificationDir);
            return Optional.empty();
        }

        List<Path> workbooks;
        try (Stream<Path> stream = Files.list(specificationDir)) {
            workbooks = stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".xlsx"))
                    .filter(p -> !p.getFileName().toString().startsWith("~$"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            warn(diagnostics, "Cannot list specification directory " + specificationDir + ": " + e.getMessage());
            return Optional.empty();
        }

        if (workbooks.isEmpty()) {
            warn(diagnostics, "No specification workbook (*.xlsx) in " + specificationDir);
            return Optional.empty();
        }
        if (workbooks.size() > 1) {
            warn(diagnostics, "Several specification workbooks in " + specificationDir + ": " + workbooks);
            return Optional.empty();
        }
        return Optional.of(workbooks.get(0));
    }

    private static void warn(ResolverDiagnostics diagnostics, String message) {
        log.warn(message);
        diagnostics.getWarnings().add(message);
    }
}
