package com.testament.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.testament.core.engine.TestParametersProvider;
import com.testament.core.selector.SuiteAliasResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TestamentConfig {

    /** Plain registry for CLI runs, where no actuator supplies one. */
    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(ObjectMapper.class)
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /** Drivers replace this bean to hand their clients to tests. */
    @Bean
    @ConditionalOnMissingBean(TestParametersProvider.class)
    public TestParametersProvider testParametersProvider() {
        return TestParametersProvider.NONE;
    }

    @Bean
    public SuiteAliasResolver suiteAliasResolver(TestamentProperties properties) {
        return new SuiteAliasResolver(properties.getSuiteAlias(), properties.getSuiteDisabled());
    }
}
