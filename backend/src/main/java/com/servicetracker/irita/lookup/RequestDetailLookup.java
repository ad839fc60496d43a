package com.servicetracker.irita.lookup;

import com.servicetracker.domain.ServiceRequest;

/**
 * Fetches full service request details by request id. Called on the block delivery thread,
 * so implementations must bound every call with a timeout.
 */
public interface RequestDetailLookup {

    /**
     * @throws RequestLookupException if the request is unknown or the lookup failed
     */
    ServiceRequest queryServiceRequest(String requestId);
}
