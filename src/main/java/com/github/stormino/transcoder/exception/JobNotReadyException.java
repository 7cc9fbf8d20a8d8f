package com.github.stormino.transcoder.exception;

import com.github.stormino.transcoder.model.JobStatus;

/**
 * Exception thrown when a job's result is requested before the conversion finished.
 */
public class JobNotReadyException extends TranscodeException {

    private final String jobId;
    private final JobStatus status;

    public JobNotReadyException(String jobId, JobStatus status) {
        super("Conversion not finished.");
        this.jobId = jobId;
        this.status = status;
    }

    public String getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
