package com.citygml.resolver.stats;

import java.nio.file.Path;

/**
 * A statistics file could not be read.
 */
public class StatFileException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StatFileException(Path path, Throwable cause) {
        super("Failed to read statistics file " + path + ": " + cause.getMessage(), cause);
    }
}
