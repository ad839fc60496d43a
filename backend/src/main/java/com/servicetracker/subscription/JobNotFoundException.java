package com.servicetracker.subscription;

/**
 * Thrown when a job has no live subscription to remove.
 */
public class JobNotFoundException extends RuntimeException {

    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job " + jobId + " not found");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
