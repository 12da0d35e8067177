package com.citygml.resolver.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.analysis.AttributeFrequencyAggregator;
import com.citygml.resolver.analysis.LayerSemanticsService;
import com.citygml.resolver.analysis.LayerSummary;
import com.citygml.resolver.cli.exception.OptionsValidationException;
import com.citygml.resolver.cli.model.ReportOptions;
import com.citygml.resolver.cli.model.ValidatedReportOptions;
import com.citygml.resolver.cli.output.ReportResultsPrinter;
import com.citygml.resolver.cli.validation.ReportOptionsValidator;
import com.citygml.resolver.core.context.ResolverConfig;
import com.citygml.resolver.dataset.ReferenceData;
import com.citygml.resolver.dataset.ReferenceDataLoader;
import com.citygml.resolver.frequency.FrequencyResolver;
import com.citygml.resolver.frequency.ResolvedFrequencyTable;
import com.citygml.resolver.report.StatReportRenderer;
import com.citygml.resolver.spec.SpecificationStructureException;
import com.citygml.resolver.stats.GmlStatDocument;
import com.citygml.resolver.stats.GmlStatReader;
import com.citygml.resolver.stats.StatFileDiscoveryService;
import com.citygml.resolver.stats.StatFileException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * Prints the statistics of a CityGML dataset with attribute descriptions and
 * codelist meanings.
 */
@Command(
        name = "report",
        mixinStandardHelpOptions = true,
        version = "citygml-attribute-resolver 1.0.0",
        description = "Resolves coded attribute values in *.stat.json files of a CityGML dataset and prints their frequencies."
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @Mixin
    private ReportOptions options = new ReportOptions();

    private final PrintStream out;

    public ReportCommand() {
        this(System.out);
    }

    public ReportCommand(PrintStream out) {
        this.out = out;
    }

    @Override
    public Integer call() {
        ReportResultsPrinter printer = new ReportResultsPrinter(out);
        try {
            ValidatedReportOptions validated = new ReportOptionsValidator().validate(options);
            printer.printBanner(options, validated);

            ResolverConfig config = ResolverConfig.builder()
                    .datasetDir(validated.getDatasetDir())
                    .specificationSheet(options.getSpecificationSheet())
                    .fetchTimeout(validated.getFetchTimeout())
                    .build();

            ReferenceData referenceData = new ReferenceDataLoader().load(config);
            printer.printReferenceData(referenceData);

            List<GmlStatDocument> documents = readStatFiles(validated.getStatsDir(), printer);

            FrequencyResolver resolver = new FrequencyResolver(referenceData.getRegistry());
            StatReportRenderer renderer = new StatReportRenderer();

            if (validated.isAggregateMode()) {
                ResolvedFrequencyTable table = new AttributeFrequencyAggregator(resolver)
                        .aggregate(documents, options.getLayer(), options.getAttribute());
                String description = referenceData.getSpecTree()
                        .describe(options.getLayer(), options.getAttribute())
                        .orElse(null);
                printer.printReport(renderer.renderFrequency(options.getLayer(), options.getAttribute(), description, table));
                return 0;
            }

            LayerSemanticsService semantics = new LayerSemanticsService(referenceData.getSpecTree(), resolver);
            for (GmlStatDocument document : documents) {
                List<LayerSummary> layers = semantics.summarize(document).stream()
                        .filter(layer -> options.getLayer() == null || options.getLayer().equals(layer.getName()))
                        .toList();
                if (!layers.isEmpty()) {
                    printer.printReport(renderer.renderLayers(document.getSource(), layers));
                }
            }
            return 0;

        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 2;
        } catch (SpecificationStructureException e) {
            log.error("Specification workbook has an unexpected layout: {}", e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("Report failed with exception", e);
            return 1;
        }
    }

    private List<GmlStatDocument> readStatFiles(Path statsDir, ReportResultsPrinter printer) throws IOException {
        List<Path> files = new StatFileDiscoveryService().discoverStatFiles(statsDir);
        GmlStatReader reader = new GmlStatReader();

        List<GmlStatDocument> documents = new ArrayList<>();
        for (Path file : files) {
            try {
                documents.add(reader.read(file));
            } catch (StatFileException e) {
                log.warn(e.getMessage());
            }
        }
        printer.printStatFileCount(files.size(), documents.size());
        return documents;
    }
}
