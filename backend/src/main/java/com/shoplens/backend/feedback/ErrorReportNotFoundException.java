package com.shoplens.backend.feedback;

public class ErrorReportNotFoundException extends RuntimeException {

    public ErrorReportNotFoundException(Long id) {
        super("Error report not found: " + id);
    }
}
