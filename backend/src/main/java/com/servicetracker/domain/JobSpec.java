package com.servicetracker.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A job definition with its activity window and initiators. Owned by job storage; the tracker only reads it.
 */
@Document(collection = "job_specs")
@CompoundIndex(name = "initiators_type", def = "{'initiators.type': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class JobSpec {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String name;
    /** Null means the job is active from creation. */
    private Instant startAt;
    /** Null means the job never ends. */
    private Instant endAt;
    private List<Initiator> initiators = new ArrayList<>();
    private Instant createdAt;

    public List<Initiator> initiatorsFor(InitiatorType type) {
        if (initiators == null) {
            return List.of();
        }
        return initiators.stream()
                .filter(i -> i != null && i.getType() == type)
                .toList();
    }

    public boolean isStarted(Instant now) {
        return startAt == null || !now.isBefore(startAt);
    }

    public boolean isEnded(Instant now) {
        return endAt != null && now.isAfter(endAt);
    }

    public boolean isActive(Instant now) {
        return isStarted(now) && !isEnded(now);
    }
}
