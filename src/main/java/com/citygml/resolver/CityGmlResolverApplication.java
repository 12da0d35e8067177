package com.citygml.resolver;

import com.citygml.resolver.cli.ReportCommand;

import picocli.CommandLine;

/**
 * Main entry point for the CityGML Attribute Resolver.
 * Reads the codelists and the attribute specification of a CityGML dataset and
 * reports the statistics files of that dataset in terms of attribute meanings.
 */
public class CityGmlResolverApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ReportCommand()).execute(args);
        System.exit(exitCode);
    }
}
