package com.grantvet.vetting.lookup;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class RevocationStatus {

    boolean found;
    boolean revoked;
    String detail;
    LocalDate revocationDate;
    String legalName;

    public static RevocationStatus notListed() {
        return RevocationStatus.builder()
                .found(false)
                .revoked(false)
                .detail("Not on the auto-revocation list")
                .build();
    }

    public static RevocationStatus revoked(LocalDate revocationDate, String legalName) {
        return RevocationStatus.builder()
                .found(true)
                .revoked(true)
                .detail("Tax-exempt status revoked" + (revocationDate != null ? " on " + revocationDate : ""))
                .revocationDate(revocationDate)
                .legalName(legalName)
                .build();
    }
}
