package com.yuzhi.spl.gateway.config;

import com.yuzhi.spl.common.config.GuardrailConfig;
import com.yuzhi.spl.common.service.QueryOrchestrator;
import com.yuzhi.spl.common.transport.SearchTransport;
import com.yuzhi.spl.gateway.service.transport.SplunkRestTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the search job orchestration from spl-common to the Splunk REST transport.
 */
@Configuration
public class QueryEngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(QueryEngineConfiguration.class);

    /**
     * Deny-list fragments are compiled here, so a malformed pattern fails startup.
     */
    @Bean
    public GuardrailConfig guardrailConfig(GuardrailProperties properties) {
        GuardrailConfig config = properties.toGuardrailConfig();
        LOG.info(
            "Guardrails loaded. safeMode={}, maxRangeSeconds={}, maxRows={}, pageSize={}, maxPolls={}, bannedCommands={}, allowDangerous={}",
            config.safeMode(),
            config.maxRangeSeconds(),
            config.maxRows(),
            config.pageSize(),
            config.maxPolls(),
            config.denyList().fragments().size(),
            config.allowDangerousCommands()
        );
        return config;
    }

    @Bean
    public SearchTransport searchTransport(RestTemplateBuilder builder, SplunkProperties properties) {
        return new SplunkRestTransport(
            builder
                .setConnectTimeout(properties.getConnectTimeout())
                .setReadTimeout(Duration.ofMillis(Math.max(1, properties.getRequestTimeoutMs())))
                .build(),
            properties
        );
    }

    @Bean
    public QueryOrchestrator queryOrchestrator(GuardrailConfig guardrailConfig, SearchTransport searchTransport, MeterRegistry meterRegistry) {
        return new QueryOrchestrator(guardrailConfig, searchTransport, meterRegistry);
    }
}
