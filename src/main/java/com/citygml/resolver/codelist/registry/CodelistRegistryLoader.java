package com.citygml.resolver.codelist.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.citygml.resolver.codelist.CodeDictionary;
import com.citygml.resolver.codelist.CodeDictionaryParser;
import com.citygml.resolver.codelist.DictionaryLoadException;
import com.citygml.resolver.core.AttributeKey;
import com.citygml.resolver.core.context.ResolverDiagnostics;

import lombok.RequiredArgsConstructor;

/**
 * Builds an {@link AttributeDictionaryRegistry} from a {@code codelists/} directory.
 *
 * Failures are recoverable at file granularity: a missing directory yields an
 * empty registry, an unreadable codelist is skipped.
 */
@RequiredArgsConstructor
public class CodelistRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(CodelistRegistryLoader.class);

    private final CodelistDiscoveryService discoveryService;
    private final CodeDictionaryParser parser;

    public CodelistRegistryLoader() {
        this(new CodelistDiscoveryService(), new CodeDictionaryParser());
    }

    public AttributeDictionaryRegistry load(Path codelistDir, ResolverDiagnostics diagnostics) {
        if (codelistDir == null || !Files.isDirectory(codelistDir)) {
            log.warn("Codelist directory not found: {}", codelistDir);
            diagnostics.getWarnings().add("Codelist directory not found: " + codelistDir);
            return AttributeDictionaryRegistry.empty();
        }

        List<Path> files;
        try {
            files = discoveryService.discoverCodelistFiles(codelistDir);
        } catch (IOException e) {
            log.warn("Cannot list codelist directory {}: {}", codelistDir, e.getMessage());
            diagnostics.getWarnings().add("Cannot list codelist directory " + codelistDir + ": " + e.getMessage());
            return AttributeDictionaryRegistry.empty();
        }
        if (files.isEmpty()) {
            log.warn("No *.xml codelists found in {}", codelistDir);
            diagnostics.getWarnings().add("No codelists found in " + codelistDir);
        }

        AttributeDictionaryRegistry.Builder builder = AttributeDictionaryRegistry.builder();
        int loaded = 0;
        for (Path file : files) {
            Optional<AttributeKey> key = CodelistFileNames.parseKey(file);
            if (key.isEmpty()) {
                log.debug("Skipping codelist with unexpected name: {}", file.getFileName());
                diagnostics.getInfos().add("Skipped codelist with unexpected name: " + file.getFileName());
                continue;
            }
            try {
                CodeDictionary dictionary = parser.parse(file.toAbsolutePath());
                builder.register(key.get(), dictionary);
                loaded++;
            } catch (DictionaryLoadException e) {
                log.warn("Skipping codelist {}: {}", file.getFileName(), e.getMessage());
                diagnostics.getErrors().add(e.getMessage());
            }
        }

        log.info("Registered {} codelists from {}", loaded, codelistDir);
        return builder.build();
    }
}
