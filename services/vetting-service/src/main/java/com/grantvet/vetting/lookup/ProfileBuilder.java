package com.grantvet.vetting.lookup;

import java.util.Optional;

/**
 * Assembles an organization profile from the business master file and parsed filings.
 * An empty result means no such organization; collaborator outages are thrown as
 * {@link com.grantvet.common.exception.UpstreamUnavailableException}.
 */
@FunctionalInterface
public interface ProfileBuilder {

    Optional<ProfileSnapshot> build(String ein);
}
