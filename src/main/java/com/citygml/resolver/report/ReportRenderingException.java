package com.citygml.resolver.report;

public class ReportRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReportRenderingException(String template, Throwable cause) {
        super("Failed to render " + template + ": " + cause.getMessage(), cause);
    }
}
