package com.servicetracker.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.stream.Stream;

/**
 * Persistence for job_specs. Used by the job store and the registration service.
 */
public interface JobSpecRepository extends MongoRepository<JobSpec, String> {

    /** Streams jobs with at least one initiator of the given type; caller must close the stream. */
    Stream<JobSpec> streamByInitiatorsType(InitiatorType type);
}
