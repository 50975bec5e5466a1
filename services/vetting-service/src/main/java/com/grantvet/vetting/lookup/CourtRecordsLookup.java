package com.grantvet.vetting.lookup;

/**
 * Federal court records search by organization name. Optional collaborator:
 * callers degrade gracefully when it is absent or failing.
 */
@FunctionalInterface
public interface CourtRecordsLookup {

    CourtRecordsResult check(String organizationName);
}
