package com.shoplens.backend.job;

/**
 * A stage could not produce its output, including a collaborator returning
 * the wrong shape.
 */
public class StageFailureException extends RuntimeException {

    public StageFailureException(String message) {
        super(message);
    }
}
