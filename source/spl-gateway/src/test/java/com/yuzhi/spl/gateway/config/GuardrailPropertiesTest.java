package com.yuzhi.spl.gateway.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.yuzhi.spl.common.config.DenyList;
import com.yuzhi.spl.common.config.GuardrailConfig;
import org.junit.jupiter.api.Test;

class GuardrailPropertiesTest {

    @Test
    void defaultsMatchEngineDefaults() {
        GuardrailConfig config = new GuardrailProperties().toGuardrailConfig();

        assertThat(config.safeMode()).isTrue();
        assertThat(config.maxRangeSeconds()).isEqualTo(86_400L);
        assertThat(config.maxRows()).isEqualTo(2000);
        assertThat(config.pageSize()).isEqualTo(200);
        assertThat(config.maxPolls()).isEqualTo(30);
        assertThat(config.denyList().fragments()).containsExactlyElementsOf(DenyList.DEFAULT_FRAGMENTS);
    }

    @Test
    void customListIgnoredUnlessOverrideIsSet() {
        GuardrailProperties properties = new GuardrailProperties();
        properties.setBannedCommands("tstats\n");

        assertThat(properties.toGuardrailConfig().denyList().fragments()).containsExactlyElementsOf(DenyList.DEFAULT_FRAGMENTS);

        properties.setOverrideBannedCommands(true);
        assertThat(properties.toGuardrailConfig().denyList().fragments()).containsExactly("tstats");
    }

    @Test
    void outOfRangeValuesAreClamped() {
        GuardrailProperties properties = new GuardrailProperties();
        properties.setPageSize(100_000);
        properties.setMaxRows(-5);
        properties.setPollIntervalMs(10);
        properties.setMaxPolls(0);

        GuardrailConfig config = properties.toGuardrailConfig();

        assertThat(config.pageSize()).isEqualTo(5000);
        assertThat(config.maxRows()).isZero();
        assertThat(config.pollIntervalMs()).isEqualTo(100L);
        assertThat(config.maxPolls()).isEqualTo(1);
    }

    @Test
    void malformedFragmentFailsLoading() {
        GuardrailProperties properties = new GuardrailProperties();
        properties.setOverrideBannedCommands(true);
        properties.setBannedCommands("delete\nmap\\s+[");

        assertThatThrownBy(properties::toGuardrailConfig).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("line 2");
    }
}
