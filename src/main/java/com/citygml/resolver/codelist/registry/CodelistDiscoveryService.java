package com.citygml.resolver.codelist.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

@NoArgsConstructor
public class CodelistDiscoveryService {

    /**
     * Codelist files directly under {@code codelistDir}, ordered by file name.
     */
    public List<Path> discoverCodelistFiles(Path codelistDir) throws IOException {
        try (Stream<Path> stream = Files.walk(codelistDir, 1)) {
            return stream.filter(Files::isRegularFile)
                    .filter(this::isCodelistFile)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }

    private boolean isCodelistFile(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xml");
    }
}
