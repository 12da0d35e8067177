package com.citygml.resolver.analysis;

import com.citygml.resolver.frequency.FrequencyResolver;
import com.citygml.resolver.stats.GmlStatDocument;
import com.citygml.resolver.stats.LayerFieldStats;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class LayerSemanticsServiceTest {

    private final LayerSemanticsService service = new LayerSemanticsService(
            AnalysisFixtures.specTree(), new FrequencyResolver(AnalysisFixtures.registry()));

    @Test
    void testDescribeField() {
        assertThat(service.describeField("Building", "usage")).contains("用途");
        assertThat(service.describeField("Building", "bldg:measuredHeight")).contains("計測高さ");
        assertThat(service.describeField("Road", "usage")).isEmpty();
    }

    @Test
    void testSummarizeLayer() {
        LayerFieldStats layer = AnalysisFixtures.layer("Building", Map.of("401", 2L));

        LayerSummary summary = service.summarize("a.gml", layer);

        assertThat(summary.getName()).isEqualTo("Building");
        assertThat(summary.getSource()).isEqualTo("a.gml");
        assertThat(summary.getNumericFields()).singleElement().satisfies(numeric -> {
            assertThat(numeric.getDescription()).isEqualTo("計測高さ");
            assertThat(numeric.getStats().getMean()).isEqualTo(6.0);
        });
        assertThat(summary.getStringFields()).extracting(StringFieldSummary::getName)
                .containsExactly("usage", "city");

        StringFieldSummary usage = summary.getStringFields().get(0);
        assertThat(usage.getDescription()).isEqualTo("用途");
        assertThat(usage.isCodelistResolved()).isTrue();
        assertThat(usage.getRawFrequencies()).containsEntry("401", 2L);
        assertThat(usage.getResolvedFrequencies()).containsEntry("住宅", 2L);

        StringFieldSummary city = summary.getStringFields().get(1);
        assertThat(city.getDescription()).isNull();
        assertThat(city.getResolvedFrequencies()).containsEntry("大阪市", 3L);
    }

    @Test
    void testSummarizeDocument() {
        GmlStatDocument document = AnalysisFixtures.document("a.gml",
                AnalysisFixtures.layer("Building", Map.of("401", 1L)),
                AnalysisFixtures.layer("Road", Map.of("401", 1L)));

        List<LayerSummary> summaries = service.summarize(document);

        assertThat(summaries).extracting(LayerSummary::getName).containsExactly("Building", "Road");
        // Road has no usage codelist of its own; the attribute-only index supplies Building's
        assertThat(summaries.get(1).getStringFields().get(0).getResolvedFrequencies()).containsEntry("住宅", 1L);
    }
}
