package com.citygml.resolver.cli.model;

import java.nio.file.Path;
import java.time.Duration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ReportCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedReportOptions {
	Path datasetDir;
	Path statsDir;
	boolean aggregateMode;
	Duration fetchTimeout;
}
