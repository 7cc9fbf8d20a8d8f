package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when no cached job has the requested id.
 */
public class JobNotFoundException extends TranscodeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Link expired or invalid.");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
