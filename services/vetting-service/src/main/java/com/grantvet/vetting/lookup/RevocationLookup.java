package com.grantvet.vetting.lookup;

/**
 * Auto-revocation list lookup. Mandatory: a failure here means the organization
 * cannot be gated, so implementations throw
 * {@link com.grantvet.common.exception.UpstreamUnavailableException} rather than
 * answering "not revoked".
 */
@FunctionalInterface
public interface RevocationLookup {

    RevocationStatus check(String ein);
}
