package com.citygml.resolver.codelist;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CodeDictionary and CodeDictionaryParser.
 */
class CodeDictionaryTest {

    @TempDir
    Path tempDir;

    @Test
    void testLoadFromLocalFile() throws IOException {
        Path file = tempDir.resolve("Building_usage.xml");
        Files.writeString(file, CodelistXml.dictionary("Building_usage",
                "401", "業務施設",
                "402", "商業施設",
                "411", "住宅"));

        CodeDictionary dictionary = CodeDictionary.load(file.toString());

        assertThat(dictionary.getSource()).isEqualTo(file.toString());
        assertThat(dictionary.size()).isEqualTo(3);
        assertThat(dictionary.lookup("401")).contains("業務施設");
        assertThat(dictionary.lookup("411")).contains("住宅");
        assertThat(dictionary.codes()).containsExactlyInAnyOrder("401", "402", "411");
    }

    @Test
    void testUnknownCodeIsAbsent() throws IOException {
        Path file = tempDir.resolve("Building_usage.xml");
        Files.writeString(file, CodelistXml.dictionary("Building_usage", "401", "業務施設"));

        CodeDictionary dictionary = CodeDictionary.load(file.toString());

        assertThat(dictionary.lookup("999")).isEmpty();
        assertThat(dictionary.lookup(null)).isEmpty();
    }

    @Test
    void testLookupIsCaseSensitive() {
        CodeDictionary dictionary = new CodeDictionary("memory", Map.of("A1", "first"));

        assertThat(dictionary.lookup("A1")).contains("first");
        assertThat(dictionary.lookup("a1")).isEmpty();
    }

    @Test
    void testSkipDefinitionsMissingNameOrDescription() throws IOException {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <gml:Dictionary xmlns:gml="http://www.opengis.net/gml" gml:id="RiverFloodingRiskAttribute_rank">
                  <gml:name>RiverFloodingRiskAttribute_rank</gml:name>
                  <gml:dictionaryEntry>
                    <gml:Definition gml:id="id1">
                      <gml:description>0.5m未満</gml:description>
                      <gml:name>1</gml:name>
                    </gml:Definition>
                  </gml:dictionaryEntry>
                  <gml:dictionaryEntry>
                    <gml:Definition gml:id="id2">
                      <gml:name>2</gml:name>
                    </gml:Definition>
                  </gml:dictionaryEntry>
                  <gml:dictionaryEntry>
                    <gml:Definition gml:id="id3">
                      <gml:description>3m以上5m未満</gml:description>
                    </gml:Definition>
                  </gml:dictionaryEntry>
                  <gml:dictionaryEntry>
                    <gml:Definition gml:id="id4">
                      <gml:description></gml:description>
                      <gml:name>4</gml:name>
                    </gml:Definition>
                  </gml:dictionaryEntry>
                </gml:Dictionary>
                """;
        Path file = tempDir.resolve("RiverFloodingRiskAttribute_rank.xml");
        Files.writeString(file, xml);

        CodeDictionary dictionary = CodeDictionary.load(file.toString());

        assertThat(dictionary.codes()).containsExactly("1");
        assertThat(dictionary.lookup("1")).contains("0.5m未満");
    }

    @Test
    void testIgnoreElementsOutsideGmlNamespace() throws IOException {
        String xml = """
                <?xml version="1.0" encoding="UTF-8"?>
                <Dictionary xmlns="http://example.com/other">
                  <dictionaryEntry>
                    <Definition>
                      <description>not gml</description>
                      <name>1</name>
                    </Definition>
                  </dictionaryEntry>
                </Dictionary>
                """;
        Path file = tempDir.resolve("Other_code.xml");
        Files.writeString(file, xml);

        assertThat(CodeDictionary.load(file.toString()).isEmpty()).isTrue();
    }

    @Test
    void testMissingFileRaisesDictionaryLoadException() {
        Path missing = tempDir.resolve("Nothing_here.xml");

        assertThatThrownBy(() -> CodeDictionary.load(missing.toString()))
                .isInstanceOf(DictionaryLoadException.class)
                .hasMessageContaining("Nothing_here.xml");
    }

    @Test
    void testMalformedXmlRaisesDictionaryLoadException() throws IOException {
        Path file = tempDir.resolve("Broken_code.xml");
        Files.writeString(file, "<gml:Dictionary xmlns:gml=\"http://www.opengis.net/gml\"><gml:dictionaryEntry>");

        assertThatThrownBy(() -> new CodeDictionaryParser().parse(file))
                .isInstanceOf(DictionaryLoadException.class)
                .satisfies(e -> assertThat(((DictionaryLoadException) e).getSource()).isEqualTo(file.toString()));
    }

    @Test
    void testReloadingGivesSameLookups() throws IOException {
        Path file = tempDir.resolve("Building_usage.xml");
        Files.writeString(file, CodelistXml.dictionary("Building_usage",
                "401", "業務施設",
                "402", "商業施設"));

        CodeDictionary first = CodeDictionary.load(file.toString());
        CodeDictionary second = CodeDictionary.load(file.toString());

        assertThat(second.codes()).containsExactlyInAnyOrderElementsOf(first.codes());
        for (String code : first.codes()) {
            assertThat(second.lookup(code)).isEqualTo(first.lookup(code));
        }
    }

    @Test
    void testEntriesAreImmutable() {
        CodeDictionary dictionary = new CodeDictionary("memory", Map.of("1", "one"));

        assertThatThrownBy(() -> dictionary.getEntries().put("2", "two"))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
