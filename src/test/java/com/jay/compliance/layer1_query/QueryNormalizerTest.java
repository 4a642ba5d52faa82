package com.jay.compliance.layer1_query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QueryNormalizer")
class QueryNormalizerTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("trims and lower-cases the name")
        void trimsAndLowercases() {
            NormalizedQuery q = normalizer.normalize("  Acme Holding B.V. ");
            assertThat(q.normalizedName()).isEqualTo("acme holding b.v.");
            assertThat(q.registrationNumber()).isFalse();
            assertThat(q.vatNumber()).isFalse();
        }

        @Test
        @DisplayName("registration number may contain inner whitespace")
        void spacedRegistrationNumber() {
            NormalizedQuery q = normalizer.normalize("6875 0110");
            assertThat(q.registrationNumber()).isTrue();
            assertThat(q.vatNumber()).isFalse();
            assertThat(q.normalizedName()).isEqualTo("6875 0110");
        }

        @Test
        @DisplayName("VAT id: two letters followed by digits")
        void vatNumber() {
            NormalizedQuery q = normalizer.normalize("NL 123456789");
            assertThat(q.vatNumber()).isTrue();
            assertThat(q.registrationNumber()).isFalse();
            assertThat(q.normalizedName()).isEqualTo("nl 123456789");
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "NL", "NLB01", "12a45"})
        @DisplayName("low-information inputs classify as neither")
        void neitherFlag(String raw) {
            NormalizedQuery q = normalizer.normalize(raw);
            assertThat(q.registrationNumber()).isFalse();
            assertThat(q.vatNumber()).isFalse();
        }

        @Test
        @DisplayName("null is treated as empty")
        void nullInput() {
            assertThat(normalizer.normalize(null)).isEqualTo(new NormalizedQuery("", false, false));
        }

        @ParameterizedTest
        @ValueSource(strings = {"  ACME  ", "6875 0110", "NL 123456789", "Café Zürich", ""})
        @DisplayName("is idempotent")
        void idempotent(String raw) {
            NormalizedQuery once = normalizer.normalize(raw);
            assertThat(normalizer.normalize(once.normalizedName())).isEqualTo(once);
        }
    }

    @Nested
    @DisplayName("cache keys")
    class Keys {

        @Test
        @DisplayName("equal logical queries share a profile key")
        void profileKeyIgnoresCaseAndPadding() {
            String a = normalizer.profileKey(new CompanyQuery("  ACME BV ", "nl", false, false));
            String b = normalizer.profileKey(new CompanyQuery("acme bv", "NL", false, true));
            assertThat(a).isEqualTo(b).isEqualTo("profile:NL:acme bv:basic");
        }

        @Test
        @DisplayName("tier is part of the profile key")
        void tierSeparatesKeys() {
            assertThat(normalizer.profileKey(new CompanyQuery("acme", "NL", true, false)))
                .isEqualTo("profile:NL:acme:premium");
        }

        @Test
        @DisplayName("search key")
        void searchKey() {
            assertThat(normalizer.searchKey(" nl ", " Acme ")).isEqualTo("search:NL:acme");
        }

        @Test
        @DisplayName("registration digits strip whitespace")
        void registrationDigits() {
            assertThat(normalizer.registrationDigits(" 6875 0110 ")).isEqualTo("68750110");
        }
    }
}
