package com.servicetracker.run;

/**
 * Thrown when the job runner rejects or fails to create a run.
 */
public class RunTriggerException extends RuntimeException {

    public RunTriggerException(String message) {
        super(message);
    }

    public RunTriggerException(String message, Throwable cause) {
        super(message, cause);
    }
}
