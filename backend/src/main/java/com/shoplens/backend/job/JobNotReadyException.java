package com.shoplens.backend.job;

import com.shoplens.backend.model.enums.JobStatus;

public class JobNotReadyException extends RuntimeException {

    public JobNotReadyException(String jobId, JobStatus status) {
        super("Analysis job " + jobId + " is not completed yet (status: " + status.toJson() + ")");
    }
}
