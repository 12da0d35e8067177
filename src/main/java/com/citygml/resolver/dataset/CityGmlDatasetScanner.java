package com.citygml.resolver.dataset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

/**
 * Finds CityGML dataset directories (the unpacked 3D city model packages).
 */
@NoArgsConstructor
public class CityGmlDatasetScanner {

    /** Building data at least must be present. */
    public static final List<String> REQUIRED_SUBDIRS = List.of(
            "codelists",
            "metadata",
            "schemas",
            "specification",
            "udx",
            "udx/bldg");

    public List<Path> findDatasets(Path rootDir) throws IOException {
        try (Stream<Path> stream = Files.walk(rootDir)) {
            return stream.filter(Files::isDirectory)
                    .filter(this::isDataset)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    public boolean isDataset(Path dir) {
        return REQUIRED_SUBDIRS.stream().allMatch(sub -> Files.isDirectory(dir.resolve(sub)));
    }
}
