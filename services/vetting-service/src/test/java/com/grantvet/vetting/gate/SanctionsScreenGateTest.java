package com.grantvet.vetting.gate;

import com.grantvet.vetting.VettingFixtures;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.sanctions.SanctionsMatch;
import com.grantvet.vetting.sanctions.SanctionsScreener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SanctionsScreenGate Tests")
class SanctionsScreenGateTest {

    @Mock
    private SanctionsScreener screener;

    private SanctionsScreenGate gate;

    @BeforeEach
    void setUp() {
        gate = new SanctionsScreenGate(screener);
    }

    @Test
    @DisplayName("Clean name should pass with a recorded sub-check")
    void cleanNameShouldPass() {
        when(screener.exactLookup(VettingFixtures.NAME)).thenReturn(List.of());

        GateResult result = gate.evaluate(VettingFixtures.healthyProfile());

        assertThat(result.isPassed()).isTrue();
        assertThat(result.getSubChecks()).singleElement().satisfies(check -> {
            assertThat(check.getLabel()).isEqualTo("exact_name_match");
            assertThat(check.isPassed()).isTrue();
        });
    }

    @Test
    @DisplayName("Listed name should fail and describe the match")
    void listedNameShouldFail() {
        when(screener.exactLookup(VettingFixtures.NAME)).thenReturn(List.of(SanctionsMatch.builder()
                .entityNumber("7711")
                .matchedName("HELPING HANDS COMMUNITY SERVICES")
                .program("SDGT")
                .entityType("Entity")
                .build()));

        GateResult result = gate.evaluate(VettingFixtures.healthyProfile());

        assertThat(result.isPassed()).isFalse();
        assertThat(result.getDetail()).isEqualTo("Exact match on the OFAC SDN list: "
                + "HELPING HANDS COMMUNITY SERVICES (entity #7711, program SDGT, Entity)");
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "--"})
    @DisplayName("Missing or blank legal name should fail without screening")
    void missingNameShouldFail(String name) {
        // given
        OrganizationProfile profile = VettingFixtures.healthyProfile().toBuilder().name(name).build();

        // when
        GateResult result = gate.evaluate(profile);

        // then
        assertThat(result.isPassed()).isFalse();
        assertThat(result.getDetail()).isEqualTo("No legal name to screen");
        assertThat(result.getSubChecks()).singleElement().satisfies(check -> {
            assertThat(check.getLabel()).isEqualTo("exact_name_match");
            assertThat(check.isPassed()).isFalse();
            assertThat(check.getDetail()).isEqualTo("No legal name to screen");
        });
        verifyNoInteractions(screener);
    }
}
