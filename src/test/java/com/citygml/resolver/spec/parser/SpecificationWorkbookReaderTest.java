package com.citygml.resolver.spec.parser;

import com.citygml.resolver.spec.AttributeSpecTree;
import com.citygml.resolver.spec.AttributeSpecTreeBuilder;
import com.citygml.resolver.spec.SpecificationStructureException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SpecificationWorkbookReaderTest {

    private static final String SHEET = "A.3.1_取得項目一覧";

    @TempDir
    Path tempDir;

    private final SpecificationWorkbookReader reader = new SpecificationWorkbookReader();

    @Test
    void testReadRowsAfterHeader() throws IOException {
        Path file = SpecificationWorkbooks.writeWorkbook(tempDir.resolve("spec.xlsx"), SHEET, 14, List.of(
                List.of("bldg", "bldg:Building", "", "", "", "", "", "建築物"),
                List.of(),
                List.of("bldg", "", "bldg:usage", "", "", "", "gml:CodeType", "用途",
                        "○", "", "", "", 1, "")));

        List<List<String>> rows = reader.read(file, SHEET);

        assertThat(rows).hasSize(2);
        assertThat(rows).allSatisfy(cells -> assertThat(cells).hasSize(14));
        assertThat(rows.get(1).get(2)).isEqualTo("bldg:usage");
        assertThat(rows.get(1).get(12)).isEqualTo("1");

        AttributeSpecTree tree = AttributeSpecTreeBuilder.fromCells(rows);
        assertThat(tree.describe("Building", "usage")).contains("用途");
    }

    @Test
    void testMissingSheet() throws IOException {
        Path file = SpecificationWorkbooks.writeWorkbook(tempDir.resolve("spec.xlsx"), "other", 14, List.of());

        assertThatThrownBy(() -> reader.read(file, SHEET))
                .isInstanceOf(SpecificationStructureException.class)
                .hasMessageContaining(SHEET);
    }

    @Test
    void testNarrowHeader() throws IOException {
        Path file = SpecificationWorkbooks.writeWorkbook(tempDir.resolve("spec.xlsx"), SHEET, 10, List.of());

        assertThatThrownBy(() -> reader.read(file, SHEET))
                .isInstanceOf(SpecificationStructureException.class)
                .hasMessageContaining("14");
    }

    @Test
    void testMissingFile() {
        assertThatThrownBy(() -> reader.read(tempDir.resolve("absent.xlsx"), SHEET))
                .isInstanceOf(IOException.class);
    }
}
