package com.project.hyperspectral.anomaly.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class DetectionPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(DetectionProperties.class)
    static class PropertiesConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class);

    @Test
    void defaults_matchReferenceConfiguration() {
        runner.run(ctx -> {
            DetectionProperties props = ctx.getBean(DetectionProperties.class);
            assertThat(props.getRows()).isEqualTo(100);
            assertThat(props.getCols()).isEqualTo(100);
            assertThat(props.getBands()).isEqualTo(50);
            assertThat(props.getComponents()).isEqualTo(5);
            assertThat(props.getContamination()).isEqualTo(0.01);
            assertThat(props.getRandomSeed()).isEqualTo(42L);
            assertThat(props.getPlantedAnomalies()).isEqualTo(20);
            assertThat(props.getCubeSeed()).isNull();
        });
    }

    @Test
    void binds_kebabCaseKeys() {
        runner.withPropertyValues("app.detection.planted-anomalies=3", "app.detection.cube-seed=9")
                .run(ctx -> {
                    DetectionProperties props = ctx.getBean(DetectionProperties.class);
                    assertThat(props.getPlantedAnomalies()).isEqualTo(3);
                    assertThat(props.getCubeSeed()).isEqualTo(9L);
                });
    }

    @Test
    void invalidContamination_failsStartup() {
        runner.withPropertyValues("app.detection.contamination=0.9")
                .run(ctx -> assertThat(ctx).hasFailed());
    }
}
