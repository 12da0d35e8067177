package com.citygml.resolver.dataset;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class CityGmlDatasetScannerTest {

    @TempDir
    Path tempDir;

    private final CityGmlDatasetScanner scanner = new CityGmlDatasetScanner();

    static Path createDataset(Path dir) throws IOException {
        for (String sub : CityGmlDatasetScanner.REQUIRED_SUBDIRS) {
            Files.createDirectories(dir.resolve(sub));
        }
        return dir;
    }

    @Test
    void testFindDatasets() throws IOException {
        Path osaka = createDataset(tempDir.resolve("27100_osaka-shi_2022"));
        Path sakai = createDataset(tempDir.resolve("nested/27140_sakai-shi_2022"));
        Files.createDirectories(tempDir.resolve("incomplete/udx/bldg"));

        assertThat(scanner.findDatasets(tempDir)).containsExactly(osaka, sakai);
    }

    @Test
    void testBuildingDataRequired() throws IOException {
        Path dir = tempDir.resolve("no-bldg");
        for (String sub : new String[]{"codelists", "metadata", "schemas", "specification", "udx"}) {
            Files.createDirectories(dir.resolve(sub));
        }

        assertThat(scanner.isDataset(dir)).isFalse();
        Files.createDirectories(dir.resolve("udx/bldg"));
        assertThat(scanner.isDataset(dir)).isTrue();
    }
}
