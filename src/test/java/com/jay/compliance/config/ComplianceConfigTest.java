package com.jay.compliance.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ComplianceConfig")
class ComplianceConfigTest {

    private ComplianceConfig config;

    @BeforeEach
    void setUp() {
        config = new ComplianceConfig();
        config.registry().setApiKey("kvk-key");
        config.sanctions().setApiKey("os-key");
    }

    @Test
    @DisplayName("defaults with credentials validate")
    void defaultsValid() {
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("enabled registry without an API key fails")
    void registryKey() {
        config.registry().setApiKey(" ");
        assertThatThrownBy(config::validate)
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("registry.api_key");
    }

    @Test
    @DisplayName("disabled sanctions adapter needs no key")
    void disabledSanctions() {
        config.sanctions().setApiKey("");
        config.sanctions().setEnabled(false);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("required API keys must be configured")
    void apiKeysRequired() {
        config.security().setRequireApiKey(true);
        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);

        config.security().setApiKeys(List.of("k1"));
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("missing PII key fails when required")
    void piiKey() {
        config.security().setPiiHashKey("");
        assertThatThrownBy(config::validate).isInstanceOf(ConfigurationException.class);
    }

    @Test
    @DisplayName("loads compliance.yaml and resolves environment placeholders")
    void loadsYaml() {
        MockEnvironment env = new MockEnvironment()
            .withProperty("KVK_API_KEY", "from-env")
            .withProperty("API_KEYS_ALLOWED", "a, b");
        ComplianceConfig loaded = new ComplianceConfig();
        ReflectionTestUtils.setField(loaded, "env", env);
        ReflectionTestUtils.setField(loaded, "configFile", "compliance-test.yaml");

        loaded.load();

        assertThat(loaded.registry().getApiKey()).isEqualTo("from-env");
        assertThat(loaded.security().getApiKeys()).containsExactly("a", "b");
        assertThat(loaded.cache().getBackingStore()).isEqualTo("local");
        assertThat(loaded.rateLimit().getTokens()).isEqualTo(5);
        assertThat(loaded.sanctions().getDatasets()).containsExactly("us_ofac_sdn");
    }
}
