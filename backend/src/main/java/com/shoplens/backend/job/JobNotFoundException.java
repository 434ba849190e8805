package com.shoplens.backend.job;

public class JobNotFoundException extends RuntimeException {

    public JobNotFoundException(String jobId) {
        super("Analysis job not found: " + jobId);
    }
}
