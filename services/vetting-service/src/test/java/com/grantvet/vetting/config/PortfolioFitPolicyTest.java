package com.grantvet.vetting.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PortfolioFitPolicy Tests")
class PortfolioFitPolicyTest {

    private final PortfolioFitPolicy policy = PortfolioFitPolicy.defaults();

    @ParameterizedTest(name = "NTEE {0} -> {1}")
    @CsvSource(nullValues = "NONE", value = {
            "B20, B",
            "p20, P",
            "W99, W",
            "Q30, NONE",
            "X20, NONE",
            "Z99, NONE",
            "'  ', NONE"
    })
    void shouldMatchAllowedPrefixes(String ntee, String expectedPrefix) {
        assertThat(policy.matchingPrefix(ntee)).isEqualTo(expectedPrefix);
    }
}
