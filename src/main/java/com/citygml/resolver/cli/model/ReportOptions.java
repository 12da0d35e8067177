package com.citygml.resolver.cli.model;

import java.nio.file.Path;

import com.citygml.resolver.core.context.ResolverConfig;

import lombok.Getter;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Holds all CLI options for the "report" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ReportOptions {

	@Parameters(index = "0", description = "CityGML dataset directory (containing codelists/ and specification/)")
	private Path datasetDir;

	@Option(names = { "--stats-dir",
			"-s" }, description = "Directory searched for *.stat.json files (defaults to the dataset directory)")
	private Path statsDir;

	@Option(names = { "--layer", "-l" }, description = "Only report this layer, e.g. Building")
	private String layer;

	@Option(names = { "--attribute",
			"-a" }, description = "Aggregate this string attribute of --layer over all statistics files")
	private String attribute;

	@Option(names = {
			"--sheet" }, defaultValue = ResolverConfig.DEFAULT_SPECIFICATION_SHEET, description = "Sheet of the specification workbook listing the attributes")
	private String specificationSheet;

	@Option(names = {
			"--fetch-timeout-seconds" }, defaultValue = "30", description = "Timeout for codelists fetched over HTTP(S)")
	private int fetchTimeoutSeconds;

}
