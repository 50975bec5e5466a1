package com.grantvet.vetting.lookup;

import com.grantvet.common.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Court records lookup guarded by a circuit breaker. While the breaker is open
 * calls fail fast instead of waiting on an unhealthy service; every failure is
 * reported as {@link UpstreamUnavailableException} so callers handle a single type.
 */
@Slf4j
@RequiredArgsConstructor
public class ResilientCourtRecordsLookup implements CourtRecordsLookup {

    static final String SERVICE_NAME = "court-records";

    private final CourtRecordsLookup delegate;
    private final CircuitBreaker circuitBreaker;

    @Override
    public CourtRecordsResult check(String organizationName) {
        try {
            CourtRecordsResult result = circuitBreaker.executeSupplier(() -> delegate.check(organizationName));
            return result != null ? result : CourtRecordsResult.none();
        } catch (CallNotPermittedException e) {
            log.debug("Court records circuit {} is open, skipping lookup", circuitBreaker.getName());
            throw new UpstreamUnavailableException(SERVICE_NAME, "Court records circuit is open", e);
        } catch (UpstreamUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new UpstreamUnavailableException(SERVICE_NAME, "Court records lookup failed: " + e.getMessage(), e);
        }
    }
}
