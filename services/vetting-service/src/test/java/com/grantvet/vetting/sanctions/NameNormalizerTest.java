package com.grantvet.vetting.sanctions;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NameNormalizer Tests")
class NameNormalizerTest {

    @ParameterizedTest(name = "\"{0}\" -> \"{1}\"")
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "The Red Cross Foundation, Inc.|red cross",
            "AL-HARAMAIN ISLAMIC FOUNDATION|al haramain islamic",
            "Médecins  Sans   Frontières|medecins sans frontieres",
            "Smith & Sons Co.|smith and sons",
            "St. Mary's Food Bank LLC|st marys food bank",
            "Foundation|foundation",
            "The Inc|inc",
            "Trust Fund Trust|trust"
    })
    @DisplayName("Should normalize case, punctuation, accents and suffixes")
    void shouldNormalize(String raw, String expected) {
        assertThat(NameNormalizer.normalize(raw).getValue()).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "The Red Cross Foundation, Inc.",
            "the the the",
            "Inc. Inc. Inc.",
            "Straße der Hoffnung e.V.",
            "İstanbul Relief Association",
            "  ---  ",
            "Global Relief Fund Ltd",
            "O'Neil & Partners, L.L.C.",
            "123 Main St. Corp"
    })
    @DisplayName("Should be idempotent")
    void shouldBeIdempotent(String raw) {
        NormalizedName once = NameNormalizer.normalize(raw);
        NormalizedName twice = NameNormalizer.normalize(once.getValue());

        assertThat(twice).isEqualTo(once);
    }

    @Test
    @DisplayName("Should map null and punctuation-only input to the empty name")
    void shouldHandleEmptyInput() {
        assertThat(NameNormalizer.normalize(null).isEmpty()).isTrue();
        assertThat(NameNormalizer.normalize("  &?!  ").getValue()).isEqualTo("and");
        assertThat(NameNormalizer.normalize(" .,; ").isEmpty()).isTrue();
    }
}
