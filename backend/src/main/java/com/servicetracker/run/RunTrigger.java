package com.servicetracker.run;

import com.servicetracker.domain.Interest;
import com.servicetracker.domain.RunRequest;

/**
 * Starts one execution of a job.
 */
public interface RunTrigger {

    /**
     * @param jobId       job to run
     * @param interest    the interest whose event caused the run
     * @param parentRunId parent run, or null for a top-level run
     * @param runRequest  run payload
     * @return id of the created run
     * @throws RunTriggerException if the run could not be created
     */
    String create(String jobId, Interest interest, String parentRunId, RunRequest runRequest);
}
