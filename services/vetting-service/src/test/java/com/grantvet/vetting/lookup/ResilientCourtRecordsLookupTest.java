package com.grantvet.vetting.lookup;

import com.grantvet.common.exception.UpstreamUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ResilientCourtRecordsLookup Tests")
class ResilientCourtRecordsLookupTest {

    @Mock
    private CourtRecordsLookup delegate;

    private CircuitBreaker circuitBreaker;
    private ResilientCourtRecordsLookup lookup;

    @BeforeEach
    void setUp() {
        circuitBreaker = CircuitBreaker.ofDefaults("courtRecords");
        lookup = new ResilientCourtRecordsLookup(delegate, circuitBreaker);
    }

    @Test
    @DisplayName("Should return the delegate's result while the circuit is closed")
    void shouldPassThroughWhenClosed() {
        CourtRecordsResult result = CourtRecordsResult.builder()
                .found(true).caseCount(1).cases(List.of(CourtCase.builder().courtCode("nysd").build())).build();
        when(delegate.check("Helping Hands")).thenReturn(result);

        assertThat(lookup.check("Helping Hands")).isSameAs(result);
    }

    @Test
    @DisplayName("Null delegate result should read as no records")
    void nullResultShouldBeNone() {
        when(delegate.check(anyString())).thenReturn(null);

        CourtRecordsResult result = lookup.check("Helping Hands");

        assertThat(result.isFound()).isFalse();
        assertThat(result.getCases()).isEmpty();
    }

    @Test
    @DisplayName("Delegate failure should surface as upstream unavailable")
    void delegateFailureShouldBeWrapped() {
        when(delegate.check(anyString())).thenThrow(new IllegalStateException("HTTP 503"));

        assertThatThrownBy(() -> lookup.check("Helping Hands"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasMessageContaining("HTTP 503")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Open circuit should fail fast without calling the delegate")
    void openCircuitShouldFailFast() {
        circuitBreaker.transitionToOpenState();

        assertThatThrownBy(() -> lookup.check("Helping Hands"))
                .isInstanceOf(UpstreamUnavailableException.class)
                .hasCauseInstanceOf(CallNotPermittedException.class)
                .satisfies(e -> assertThat(((UpstreamUnavailableException) e).getServiceName())
                        .isEqualTo("court-records"));
        verifyNoInteractions(delegate);
    }
}
