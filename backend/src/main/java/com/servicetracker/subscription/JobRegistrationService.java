package com.servicetracker.subscription;

import com.servicetracker.domain.JobSpec;
import com.servicetracker.domain.JobSpecRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

/**
 * Stores job specs and keeps the tracker in step with them.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobRegistrationService {

    private final JobSpecRepository jobSpecRepository;
    private final SubscriptionTracker tracker;
    private final Clock clock = Clock.systemUTC();

    /**
     * Saves the job and starts its workers. A job whose subscription fails stays stored and is retried on the
     * next tracker start.
     *
     * @throws com.servicetracker.irita.event.SubscriptionException if an interest could not subscribe
     */
    public Registration register(JobSpec job) {
        if (job.getId() == null || job.getId().isBlank()) {
            job.setId(UUID.randomUUID().toString());
        }
        if (job.getCreatedAt() == null) {
            job.setCreatedAt(clock.instant());
        }
        JobSpec saved = jobSpecRepository.save(job);
        int workers = tracker.addJob(saved);
        log.info("Registered job {} with {} worker(s)", saved.getId(), workers);
        return new Registration(saved, workers);
    }

    /**
     * Deletes the job and stops its workers.
     *
     * @throws JobNotFoundException if the job is neither stored nor tracked
     */
    public void remove(String jobId) {
        boolean stored = jobSpecRepository.existsById(jobId);
        if (stored) {
            jobSpecRepository.deleteById(jobId);
        }
        try {
            tracker.removeJob(jobId);
        } catch (JobNotFoundException e) {
            if (!stored) {
                throw e;
            }
            log.debug("Job {} deleted; it had no live subscription", jobId);
        }
    }

    public record Registration(JobSpec job, int workers) {}
}
