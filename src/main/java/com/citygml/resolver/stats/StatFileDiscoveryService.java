package com.citygml.resolver.stats;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class StatFileDiscoveryService {

    public static final String STAT_SUFFIX = ".stat.json";

    /**
     * All {@code *.stat.json} files below {@code datasetDir}, in path order.
     */
    public List<Path> discoverStatFiles(Path datasetDir) throws IOException {
        try (Stream<Path> stream = Files.walk(datasetDir)) {
            return stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(STAT_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }
}
