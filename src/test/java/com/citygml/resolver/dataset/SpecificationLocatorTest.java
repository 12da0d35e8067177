package com.citygml.resolver.dataset;

import com.citygml.resolver.core.context.ResolverDiagnostics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class SpecificationLocatorTest {

    @TempDir
    Path tempDir;

    private final SpecificationLocator locator = new SpecificationLocator();
    private final ResolverDiagnostics diagnostics = new ResolverDiagnostics();

    @Test
    void testSingleWorkbook() throws IOException {
        Path workbook = Files.createFile(tempDir.resolve("27100_osaka-shi_2022_objectlist_op.xlsx"));
        Files.createFile(tempDir.resolve("~$27100_osaka-shi_2022_objectlist_op.xlsx"));
        Files.createFile(tempDir.resolve("readme.pdf"));

        assertThat(locator.locate(tempDir, diagnostics)).contains(workbook);
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testNoWorkbook() {
        assertThat(locator.locate(tempDir, diagnostics)).isEmpty();
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("No specification workbook");
    }

    @Test
    void testSeveralWorkbooks() throws IOException {
        Files.createFile(tempDir.resolve("a.xlsx"));
        Files.createFile(tempDir.resolve("b.xlsx"));

        assertThat(locator.locate(tempDir, diagnostics)).isEmpty();
        assertThat(diagnostics.getWarnings()).singleElement().asString().contains("Several");
    }

    @Test
    void testMissingDirectory() {
        assertThat(locator.locate(tempDir.resolve("specification"), diagnostics)).isEmpty();
        assertThat(diagnostics.hasWarnings()).isTrue();
    }
}
