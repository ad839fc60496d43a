package com.servicetracker.api.controller;

import com.servicetracker.api.dto.ErrorBody;
import com.servicetracker.api.dto.InitiatorRequest;
import com.servicetracker.api.dto.RegisterJobRequest;
import com.servicetracker.api.dto.RegisterJobResponse;
import com.servicetracker.api.dto.SubscriptionsResponse;
import com.servicetracker.domain.Initiator;
import com.servicetracker.domain.InitiatorType;
import com.servicetracker.domain.JobSpec;
import com.servicetracker.subscription.JobRegistrationService;
import com.servicetracker.subscription.SubscriptionTracker;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;

/**
 * POST /api/v1/jobs, DELETE /api/v1/jobs/{jobId}, GET /api/v1/subscriptions.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class JobController {

    private final JobRegistrationService jobRegistrationService;
    private final SubscriptionTracker subscriptionTracker;

    @PostMapping("/jobs")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterJobRequest request) {
        for (InitiatorRequest initiator : request.initiators()) {
            if (initiator.type() == InitiatorType.IRITA_LOG
                    && (isBlank(initiator.serviceProvider()) || isBlank(initiator.serviceName()))) {
                return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_INITIATOR",
                        "IRITA_LOG initiators need serviceProvider and serviceName"));
            }
        }
        if (request.startAt() != null && request.endAt() != null && request.endAt().isBefore(request.startAt())) {
            return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_WINDOW", "endAt is before startAt"));
        }
        JobRegistrationService.Registration registration = jobRegistrationService.register(toJobSpec(request));
        String message = subscriptionTracker.isStarted() ? "Job registered" : "Job stored; tracker not started";
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new RegisterJobResponse(registration.job().getId(), registration.workers(), message));
    }

    @DeleteMapping("/jobs/{jobId}")
    public ResponseEntity<Void> remove(@PathVariable String jobId) {
        jobRegistrationService.remove(jobId.trim());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/subscriptions")
    public SubscriptionsResponse subscriptions() {
        return new SubscriptionsResponse(
                subscriptionTracker.isStarted(),
                subscriptionTracker.jobCount(),
                subscriptionTracker.subscriptionCount());
    }

    private static JobSpec toJobSpec(RegisterJobRequest request) {
        JobSpec job = new JobSpec();
        job.setId(isBlank(request.id()) ? null : request.id().trim());
        job.setName(request.name());
        job.setStartAt(request.startAt());
        job.setEndAt(request.endAt());
        List<Initiator> initiators = request.initiators().stream()
                .map(i -> new Initiator(i.type(), trimOrNull(i.serviceProvider()), trimOrNull(i.serviceName())))
                .toList();
        job.setInitiators(new ArrayList<>(initiators));
        return job;
    }

    private static String trimOrNull(String value) {
        return value == null ? null : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
