package com.servicetracker.subscription.store;

import com.servicetracker.domain.InitiatorType;
import com.servicetracker.domain.JobSpec;
import com.servicetracker.domain.JobSpecRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * {@link JobStore} over the job_specs collection, streaming so large job sets are not loaded at once.
 */
@Component
@RequiredArgsConstructor
public class MongoJobStore implements JobStore {

    private final JobSpecRepository jobSpecRepository;

    @Override
    public void forEachJob(Predicate<JobSpec> visitor, InitiatorType type) {
        try (Stream<JobSpec> jobs = jobSpecRepository.streamByInitiatorsType(type)) {
            Iterator<JobSpec> it = jobs.iterator();
            while (it.hasNext()) {
                if (!visitor.test(it.next())) {
                    return;
                }
            }
        }
    }
}
