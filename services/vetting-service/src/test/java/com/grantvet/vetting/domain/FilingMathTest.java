package com.grantvet.vetting.domain;

import com.grantvet.vetting.VettingFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FilingMath Tests")
class FilingMathTest {

    @Test
    @DisplayName("Should compute overhead ratio and null it for non-positive revenue")
    void shouldComputeOverheadRatio() {
        assertThat(FilingMath.overheadRatio(BigDecimal.valueOf(200), BigDecimal.valueOf(150))).isEqualTo(0.75);
        assertThat(FilingMath.overheadRatio(BigDecimal.ZERO, BigDecimal.valueOf(150))).isNull();
        assertThat(FilingMath.overheadRatio(BigDecimal.valueOf(-5), BigDecimal.valueOf(150))).isNull();
        assertThat(FilingMath.overheadRatio(null, BigDecimal.valueOf(150))).isNull();
    }

    @Test
    @DisplayName("Should compute compensation ratio against expenses")
    void shouldComputeCompensationRatio() {
        assertThat(FilingMath.compensationRatio(BigDecimal.valueOf(30), BigDecimal.valueOf(100))).isEqualTo(0.3);
        assertThat(FilingMath.compensationRatio(BigDecimal.valueOf(30), BigDecimal.ZERO)).isNull();
    }

    @Test
    @DisplayName("Should compute whole years operating and discard implausible dates")
    void shouldComputeYearsOperating() {
        assertThat(FilingMath.yearsOperating(LocalDate.of(2010, 6, 16), VettingFixtures.CLOCK)).isEqualTo(14);
        assertThat(FilingMath.yearsOperating(LocalDate.of(2010, 6, 15), VettingFixtures.CLOCK)).isEqualTo(15);
        assertThat(FilingMath.yearsOperating(LocalDate.of(1900, 1, 1), VettingFixtures.CLOCK)).isNull();
        assertThat(FilingMath.yearsOperating(LocalDate.of(2030, 1, 1), VettingFixtures.CLOCK)).isNull();
        assertThat(FilingMath.yearsOperating(null, VettingFixtures.CLOCK)).isNull();
    }

    @Test
    @DisplayName("Profile builder should keep subsection two digits wide and ratios finite")
    void shouldEnforceProfileInvariants() {
        OrganizationProfile profile = VettingFixtures.healthyProfile().toBuilder().subsection("3").build();
        LatestFilingSummary filing = LatestFilingSummary.builder()
                .overheadRatio(Double.NaN)
                .officerCompensationRatio(Double.POSITIVE_INFINITY)
                .build();

        assertThat(profile.getSubsection()).isEqualTo("03");
        assertThat(filing.getOverheadRatio()).isNull();
        assertThat(filing.getOfficerCompensationRatio()).isNull();
        assertThat(FilingMath.normalizeSubsection("  ")).isNull();
    }
}
