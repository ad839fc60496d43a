package com.servicetracker.subscription;

import com.servicetracker.domain.Interest;
import com.servicetracker.domain.ResolvedRequest;
import com.servicetracker.domain.ServiceRequest;
import com.servicetracker.irita.lookup.RequestDetailLookup;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Resolves matched request ids one lookup at a time. A failed lookup drops that id only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RequestResolver {

    private final RequestDetailLookup requestDetailLookup;

    public List<ResolvedRequest> resolve(Collection<String> requestIds, Interest interest) {
        if (requestIds == null || requestIds.isEmpty()) {
            return List.of();
        }
        List<ResolvedRequest> resolved = new ArrayList<>(requestIds.size());
        for (String requestId : requestIds) {
            try {
                ServiceRequest request = requestDetailLookup.queryServiceRequest(requestId);
                resolved.add(new ResolvedRequest(request, interest.provider()));
            } catch (RuntimeException e) {
                log.warn("Dropping service request {} for {}: {}", requestId, interest, e.getMessage());
            }
        }
        return resolved;
    }
}
