package com.citygml.resolver.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import com.citygml.resolver.cli.exception.OptionsValidationException;
import com.citygml.resolver.cli.model.ReportOptions;
import com.citygml.resolver.cli.model.ValidatedReportOptions;

public class ReportOptionsValidator {

	public ValidatedReportOptions validate(ReportOptions o) {
		List<String> errors = new ArrayList<>();

		Path datasetDir = null;
		if (o.getDatasetDir() == null) {
			errors.add("Dataset directory is required.");
		} else if (!existsDirectory(o.getDatasetDir())) {
			errors.add("Dataset directory does not exist or is not a directory: " + o.getDatasetDir());
		} else {
			datasetDir = o.getDatasetDir().toAbsolutePath().normalize();
		}

		Path statsDir = datasetDir;
		if (o.getStatsDir() != null) {
			if (!existsDirectory(o.getStatsDir())) {
				errors.add("Statistics directory does not exist or is not a directory: " + o.getStatsDir());
			} else {
				statsDir = o.getStatsDir().toAbsolutePath().normalize();
			}
		}

		boolean aggregateMode = !isBlank(o.getAttribute());
		if (aggregateMode && isBlank(o.getLayer())) {
			errors.add("--attribute requires --layer.");
		}

		if (isBlank(o.getSpecificationSheet())) {
			errors.add("Specification sheet name must not be blank (--sheet).");
		}

		if (o.getFetchTimeoutSeconds() <= 0) {
			errors.add("Fetch timeout must be > 0. Got: " + o.getFetchTimeoutSeconds());
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return new ValidatedReportOptions(datasetDir, statsDir, aggregateMode,
				Duration.ofSeconds(o.getFetchTimeoutSeconds()));
	}

	private static boolean existsDirectory(Path p) {
		return p != null && Files.exists(p) && Files.isDirectory(p);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
