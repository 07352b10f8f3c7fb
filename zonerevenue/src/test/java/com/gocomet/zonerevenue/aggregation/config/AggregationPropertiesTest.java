package com.gocomet.zonerevenue.aggregation.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.validation.BindValidationException;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

class AggregationPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void bothZonesUnsetMeansNoConversion() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(AggregationProperties.class).convertsTimeZone()).isFalse();
        });
    }

    @Test
    void bothZonesSetEnableConversion() {
        contextRunner
                .withPropertyValues(
                        "app.aggregation.source-time-zone=America/New_York",
                        "app.aggregation.bucket-time-zone=UTC")
                .run(context -> {
                    AggregationProperties properties = context.getBean(AggregationProperties.class);
                    assertThat(properties.getSourceTimeZone()).isEqualTo(ZoneId.of("America/New_York"));
                    assertThat(properties.convertsTimeZone()).isTrue();
                });
    }

    @Test
    void onlyOneZoneIsRejected() {
        contextRunner
                .withPropertyValues("app.aggregation.source-time-zone=America/New_York")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .rootCause()
                            .isInstanceOf(BindValidationException.class)
                            .hasMessageContaining("must be set together");
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(AggregationProperties.class)
    static class PropertiesConfiguration {
    }
}
