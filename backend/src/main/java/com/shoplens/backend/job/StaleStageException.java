package com.shoplens.backend.job;

import com.shoplens.backend.model.enums.StageName;

/**
 * A stage commit that is not the immediate successor of the job's current
 * stage. The job is left untouched.
 */
public class StaleStageException extends RuntimeException {

    private final String jobId;
    private final StageName attempted;
    private final StageName current;

    public StaleStageException(String jobId, StageName attempted, StageName current, String reason) {
        super("Rejected commit of stage " + attempted.getKey() + " for job " + jobId
                + " at stage " + current.getKey() + ": " + reason);
        this.jobId = jobId;
        this.attempted = attempted;
        this.current = current;
    }

    public String getJobId() {
        return jobId;
    }

    public StageName getAttempted() {
        return attempted;
    }

    public StageName getCurrent() {
        return current;
    }
}
