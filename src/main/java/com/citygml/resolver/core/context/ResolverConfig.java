package com.citygml.resolver.core.context;

import java.nio.file.Path;
import java.time.Duration;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for loading the reference data of one CityGML dataset.
 *
 * A dataset directory is expected to hold a {@code codelists/} directory of
 * {@code {Feature}_{Attribute}.xml} files and a {@code specification/} directory
 * with a single attribute specification workbook.
 */
@Data
@Builder
public class ResolverConfig {

    public static final String DEFAULT_SPECIFICATION_SHEET = "A.3.1_取得項目一覧";
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);

    /**
     * Root directory of the dataset.
     */
    private Path datasetDir;

    /**
     * Sheet of the specification workbook that lists the attributes.
     */
    @Builder.Default
    private String specificationSheet = DEFAULT_SPECIFICATION_SHEET;

    /**
     * Timeout for fetching codelists published over HTTP(S).
     */
    @Builder.Default
    private Duration fetchTimeout = DEFAULT_FETCH_TIMEOUT;

    public Path getCodelistDir() {
        return datasetDir.resolve("codelists");
    }

    public Path getSpecificationDir() {
        return datasetDir.resolve("specification");
    }
}
