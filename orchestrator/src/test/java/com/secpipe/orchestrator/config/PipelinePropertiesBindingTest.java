package com.secpipe.orchestrator.config;

import com.secpipe.orchestrator.stage.StandardStages;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.ConfigDataApplicationContextInitializer;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Binds the shipped application.yml onto {@link PipelineProperties} without
 * starting the web, JPA or mail layers, so a malformed config fails here.
 */
class PipelinePropertiesBindingTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withInitializer(new ConfigDataApplicationContextInitializer())
            .withUserConfiguration(PropertiesConfig.class)
            .withPropertyValues(
                    "SECPIPE_WORKSPACE=/srv/checkout",
                    "REPORT_DIR=report",
                    "IMAGE_TAG=secpipe-app:ci",
                    "CONFLUENCE_URL=https://docs.example.com/wiki/",
                    "RECEIVER_EMAIL=team@example.com, qa@example.com");

    @Test
    void applicationYml_bindsToolCommandsWithResolvedPlaceholders() {
        runner.run(context -> {
            assertThat(context).hasNotFailed();
            PipelineProperties props = context.getBean(PipelineProperties.class);

            assertThat(props.tools().get("unit-tests").command())
                    .containsExactly("pytest", "--html=report/report.html", "--self-contained-html");
            assertThat(props.tools().get("sast").command()).endsWith("report/bandit_report.html");
            assertThat(props.tools().get("image-build").command()).contains("secpipe-app:ci");
            assertThat(props.tools().get("image-scan").command())
                    .containsSubsequence("--severity", "HIGH,CRITICAL", "secpipe-app:ci");
            assertThat(props.tools().get("environment-setup").timeout()).isEqualTo(Duration.ofMinutes(20));
            assertThat(props.tools().get("environment-setup").requiredFiles()).containsExactly("requirements.txt");
        });
    }

    @Test
    void applicationYml_bindsDefaultsForEveryToggleAndService() {
        runner.run(context -> {
            PipelineProperties props = context.getBean(PipelineProperties.class);

            assertThat(props.workspace()).isEqualTo(Path.of("/srv/checkout"));
            assertThat(props.reportDir()).isEqualTo(Path.of("/srv/checkout/report"));
            assertThat(props.toggles().keySet()).containsExactlyInAnyOrderElementsOf(StandardStages.toggleNames());
            assertThat(props.fatalStages()).containsExactlyInAnyOrder("prepare", "environment-setup", "image-build");
            assertThat(props.pdfCommand()).containsExactly("wkhtmltopdf", "--quiet");
            assertThat(props.dast().readinessTimeout()).isEqualTo(Duration.ofSeconds(60));
            assertThat(props.documentation().baseUrl()).isEqualTo("https://docs.example.com/wiki");
            assertThat(props.mail().to()).isEqualTo(List.of("team@example.com", "qa@example.com"));
            assertThat(props.runOnStartup()).isFalse();
        });
    }

    @Test
    void cliProfile_turnsOnRunOnStartup() {
        runner.withPropertyValues("spring.profiles.active=cli").run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(PipelineProperties.class).runOnStartup()).isTrue();
        });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(PipelineProperties.class)
    static class PropertiesConfig {
    }
}
