package com.grantvet.vetting.gate;

import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.OrganizationProfile;

/**
 * A hard pass/fail eligibility check. Implementations evaluate every one of
 * their sub-checks; a failing sub-check never stops the others.
 */
public interface EligibilityGate {

    String name();

    GateResult evaluate(OrganizationProfile profile);
}
