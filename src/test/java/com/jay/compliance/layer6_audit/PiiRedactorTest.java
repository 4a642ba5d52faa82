package com.jay.compliance.layer6_audit;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PiiRedactor")
class PiiRedactorTest {

    private final PiiRedactor redactor = new PiiRedactor("secret-1");

    @Test
    @DisplayName("redacts emails and phone numbers, keeps names")
    void emailAndPhone() {
        assertThat(redactor.redact("call John at john@x.com or +31 6 1234 5678"))
            .isEqualTo("call John at [REDACTED] or [REDACTED]");
    }

    @Test
    @DisplayName("redacts registry-style identifiers")
    void registryIds() {
        assertThat(redactor.redact("id NL 12345678 found")).isEqualTo("id [REDACTED] found");
    }

    @Test
    @DisplayName("short numbers and plain text pass through")
    void untouched() {
        assertThat(redactor.redact("registry:search:multiple_or_none:2")).isEqualTo("registry:search:multiple_or_none:2");
        assertThat(redactor.redact("")).isEmpty();
        assertThat(redactor.redact(null)).isNull();
    }

    @Test
    @DisplayName("hash is deterministic, keyed and hex encoded")
    void hash() {
        String a = redactor.hashIdentifier("12345678");

        assertThat(a).hasSize(64).matches("[0-9a-f]+");
        assertThat(redactor.hashIdentifier("12345678")).isEqualTo(a);
        assertThat(new PiiRedactor("secret-2").hashIdentifier("12345678")).isNotEqualTo(a);
        assertThat(redactor.hashIdentifier("")).isEmpty();
        assertThat(redactor.hashIdentifier(null)).isEmpty();
    }
}
