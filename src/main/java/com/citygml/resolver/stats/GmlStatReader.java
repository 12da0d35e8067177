package com.citygml.resolver.stats;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

public class GmlStatReader {
    private static final Logger log = LoggerFactory.getLogger(GmlStatReader.class);

    private final ObjectMapper objectMapper;

    public GmlStatReader() {
        this(new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));
    }

    public GmlStatReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public GmlStatDocument read(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            GmlStatDocument document = objectMapper.readValue(is, GmlStatDocument.class);
            log.debug("Read {} layers from {}", document.layerCount(), path.getFileName());
            return document;
        } catch (IOException e) {
            throw new StatFileException(path, e);
        }
    }
}
