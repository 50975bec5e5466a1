package com.grantvet.vetting.gate;

import com.grantvet.common.exception.UpstreamUnavailableException;
import com.grantvet.vetting.VettingFixtures;
import com.grantvet.vetting.config.PortfolioFitPolicy;
import com.grantvet.vetting.domain.GateLayerResult;
import com.grantvet.vetting.domain.GateResult;
import com.grantvet.vetting.domain.GateVerdict;
import com.grantvet.vetting.domain.OrganizationProfile;
import com.grantvet.vetting.lookup.RevocationLookup;
import com.grantvet.vetting.lookup.RevocationStatus;
import com.grantvet.vetting.sanctions.MatchBasis;
import com.grantvet.vetting.sanctions.SanctionsMatch;
import com.grantvet.vetting.sanctions.SanctionsScreener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GateEngine Tests")
class GateEngineTest {

    @Mock
    private RevocationLookup revocationLookup;

    @Mock
    private SanctionsScreener screener;

    private GateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new GateEngine(revocationLookup, screener, PortfolioFitPolicy.defaults());
    }

    @Test
    @DisplayName("Should evaluate the four gates in fixed order")
    void shouldEvaluateGatesInOrder() {
        assertThat(engine.gateNames()).containsExactly(
                Verified501c3Gate.NAME, SanctionsScreenGate.NAME, FilingExistsGate.NAME, PortfolioFitGate.NAME);
    }

    @Test
    @DisplayName("Clean 501(c)(3) with ruling date should pass gates 1 and 2")
    void shouldPassCleanCharity() {
        // Given
        when(revocationLookup.check(VettingFixtures.EIN)).thenReturn(RevocationStatus.notListed());
        when(screener.exactLookup(VettingFixtures.NAME)).thenReturn(List.of());

        // When
        GateLayerResult layer = engine.evaluate(VettingFixtures.healthyProfile());

        // Then
        assertThat(layer.isAllPassed()).isTrue();
        assertThat(layer.getBlockingGate()).isNull();
        assertThat(layer.getGates()).extracting(GateResult::getVerdict).containsOnly(GateVerdict.PASS);
        assertThat(layer.getGates().get(0).getSubChecks()).hasSize(3);
    }

    @Nested
    @DisplayName("Blocking gate")
    class BlockingGateTests {

        @Test
        @DisplayName("Wrong subsection should block at verified_501c3 even when later gates fail too")
        void shouldBlockAtFirstGate() {
            // Given
            OrganizationProfile profile = VettingFixtures.healthyProfile().toBuilder()
                    .subsection("04")
                    .latestFiling(null)
                    .filingCount(0)
                    .build();
            when(revocationLookup.check(anyString())).thenReturn(RevocationStatus.notListed());
            when(screener.exactLookup(anyString())).thenReturn(List.of(sdnMatch()));

            // When
            GateLayerResult layer = engine.evaluate(profile);

            // Then
            assertThat(layer.getBlockingGate()).isEqualTo(Verified501c3Gate.NAME);
            assertThat(layer.getGates()).extracting(GateResult::getVerdict)
                    .containsExactly(GateVerdict.FAIL, GateVerdict.FAIL, GateVerdict.FAIL, GateVerdict.PASS);
            verify(screener).exactLookup(VettingFixtures.NAME);
        }

        @Test
        @DisplayName("Exact sanctions match should block at ofac_sanctions and list the match")
        void shouldBlockOnSanctionsMatch() {
            when(revocationLookup.check(anyString())).thenReturn(RevocationStatus.notListed());
            when(screener.exactLookup(anyString())).thenReturn(List.of(sdnMatch()));

            GateLayerResult layer = engine.evaluate(VettingFixtures.healthyProfile());

            assertThat(layer.getBlockingGate()).isEqualTo(SanctionsScreenGate.NAME);
            assertThat(layer.getGates().get(1).getDetail())
                    .startsWith("Exact match on the OFAC SDN list")
                    .contains("HELPING HANDS COMMUNITY SERVICES (entity #7711, program SDGT, Entity)");
        }

        @Test
        @DisplayName("Revoked organization should fail gate 1 with the revocation detail")
        void shouldFailRevokedOrganization() {
            when(revocationLookup.check(anyString()))
                    .thenReturn(RevocationStatus.revoked(LocalDate.of(2021, 5, 15), VettingFixtures.NAME));
            when(screener.exactLookup(anyString())).thenReturn(List.of());

            GateResult gate = engine.evaluate(VettingFixtures.healthyProfile()).getGates().get(0);

            assertThat(gate.isPassed()).isFalse();
            assertThat(gate.getDetail()).contains("revoked on 2021-05-15");
            assertThat(gate.getSubChecks()).extracting("label", "passed").contains(
                    tuple("subsection_501c3", true),
                    tuple("not_revoked", false),
                    tuple("ruling_date", true));
        }

        @Test
        @DisplayName("Missing ruling date should fail gate 1")
        void shouldFailWithoutRulingDate() {
            when(revocationLookup.check(anyString())).thenReturn(RevocationStatus.notListed());
            when(screener.exactLookup(anyString())).thenReturn(List.of());

            GateLayerResult layer = engine.evaluate(VettingFixtures.healthyProfile().toBuilder().rulingDate(null).build());

            assertThat(layer.getBlockingGate()).isEqualTo(Verified501c3Gate.NAME);
            assertThat(layer.getGates().get(0).getDetail()).isEqualTo("No IRS ruling date on record");
        }

        @Test
        @DisplayName("No filings should block at filing_exists")
        void shouldBlockWithoutFilings() {
            when(revocationLookup.check(anyString())).thenReturn(RevocationStatus.notListed());
            when(screener.exactLookup(anyString())).thenReturn(List.of());

            GateLayerResult layer = engine.evaluate(VettingFixtures.healthyProfile().toBuilder()
                    .latestFiling(null).filingCount(0).build());

            assertThat(layer.getBlockingGate()).isEqualTo(FilingExistsGate.NAME);
        }

        @Test
        @DisplayName("A filing count alone should satisfy filing_exists")
        void shouldAcceptFilingCountAlone() {
            when(revocationLookup.check(anyString())).thenReturn(RevocationStatus.notListed());
            when(screener.exactLookup(anyString())).thenReturn(List.of());

            GateLayerResult layer = engine.evaluate(VettingFixtures.healthyProfile().toBuilder()
                    .latestFiling(null).filingCount(2).build());

            assertThat(layer.isAllPassed()).isTrue();
            assertThat(layer.getGates().get(2).getDetail()).isEqualTo("2 filing(s) on record");
        }
    }

    @Test
    @DisplayName("Revocation lookup failure should propagate rather than pass")
    void shouldPropagateRevocationFailure() {
        when(revocationLookup.check(anyString()))
                .thenThrow(new UpstreamUnavailableException("revocation-list", "Revocation list not loaded"));

        assertThatThrownBy(() -> engine.evaluate(VettingFixtures.healthyProfile()))
                .isInstanceOf(UpstreamUnavailableException.class);
    }

    private static SanctionsMatch sdnMatch() {
        return SanctionsMatch.builder()
                .entityNumber("7711")
                .matchedName("HELPING HANDS COMMUNITY SERVICES")
                .entityType("Entity")
                .program("SDGT")
                .basis(MatchBasis.EXACT)
                .build();
    }
}
