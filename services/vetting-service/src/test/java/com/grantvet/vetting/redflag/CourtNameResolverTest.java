package com.grantvet.vetting.redflag;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CourtNameResolver Tests")
class CourtNameResolverTest {

    @Test
    @DisplayName("Bundled table should resolve federal court codes case-insensitively")
    void shouldResolveBundledCodes() {
        CourtNameResolver resolver = CourtNameResolver.fromClasspath();

        assertThat(resolver.resolve("nysd")).isEqualTo("S.D. New York");
        assertThat(resolver.resolve("CA9")).isEqualTo("9th Circuit");
        assertThat(resolver.resolve(" cadc ")).isEqualTo("D.C. Circuit");
    }

    @Test
    @DisplayName("Unknown codes should resolve to themselves")
    void unknownCodeShouldPassThrough() {
        CourtNameResolver resolver = new CourtNameResolver(Map.of("nysd", "S.D. New York"));

        assertThat(resolver.resolve("zzdist")).isEqualTo("zzdist");
        assertThat(resolver.resolve("")).isEqualTo("Unknown court");
        assertThat(resolver.resolve(null)).isEqualTo("Unknown court");
    }

    @Test
    @DisplayName("Missing table should yield an empty resolver")
    void missingTableShouldBeEmpty() {
        CourtNameResolver resolver = CourtNameResolver.fromClasspath("no-such-courts.properties");

        assertThat(resolver.resolve("nysd")).isEqualTo("nysd");
    }
}
