package com.citygml.resolver.cli.output;

import java.io.PrintStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.cli.model.ReportOptions;
import com.citygml.resolver.cli.model.ValidatedReportOptions;
import com.citygml.resolver.core.context.ResolverDiagnostics;
import com.citygml.resolver.dataset.ReferenceData;

/**
 * Responsible only for printing CLI output for the "report" command.
 * Banner and diagnostics go to the log; rendered reports go to {@code out}.
 */
public class ReportResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ReportResultsPrinter.class);

    private final PrintStream out;

    public ReportResultsPrinter(PrintStream out) {
        this.out = out;
    }

    public void printBanner(ReportOptions o, ValidatedReportOptions v) {
        log.info("=================================================");
        log.info("CityGML Attribute Resolver");
        log.info("=================================================");
        log.info("Dataset Directory: {}", v.getDatasetDir());
        log.info("Statistics Directory: {}", v.getStatsDir());
        log.info("Specification Sheet: {}", o.getSpecificationSheet());
        log.info("Layer: {}", o.getLayer() != null ? o.getLayer() : "All");
        if (v.isAggregateMode()) {
            log.info("Aggregated Attribute: {}", o.getAttribute());
        }
        log.info("=================================================");
    }

    public void printReferenceData(ReferenceData referenceData) {
        log.info("Codelists Registered: {}", referenceData.getRegistry().size());
        log.info("Specification Nodes: {}", referenceData.getSpecTree().size());
        printDiagnostics(referenceData.getDiagnostics());
    }

    public void printReport(String report) {
        out.print(report);
        out.flush();
    }

    public void printDiagnostics(ResolverDiagnostics diagnostics) {
        for (String warning : diagnostics.getWarnings()) {
            log.warn("  {}", warning);
        }
        for (String error : diagnostics.getErrors()) {
            log.warn("  Skipped: {}", error);
        }
    }

    public void printStatFileCount(int found, int read) {
        log.info("Statistics Files: {} found, {} read", found, read);
    }
}
