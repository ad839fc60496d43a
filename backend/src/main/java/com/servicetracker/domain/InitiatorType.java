package com.servicetracker.domain;

/**
 * How a job gets triggered. Only {@link #IRITA_LOG} jobs are tracked by the subscription engine.
 */
public enum InitiatorType {
    IRITA_LOG,
    WEB,
    CRON
}
