package com.shoplens.backend.job;

/**
 * Rejected submission. Raised before any job record exists.
 */
public class SubmissionException extends RuntimeException {

    public SubmissionException(String message) {
        super(message);
    }
}
