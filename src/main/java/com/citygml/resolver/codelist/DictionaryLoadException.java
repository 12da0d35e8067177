package com.citygml.resolver.codelist;

/**
 * Raised when a codelist source is unreachable or is not a readable GML dictionary.
 */
public class DictionaryLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String source;

    public DictionaryLoadException(String source, String message, Throwable cause) {
        super("Failed to load codelist " + source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
