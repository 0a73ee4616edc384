package com.secpipe.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.correlate.VersionCorrelator;
import com.secpipe.orchestrator.notify.MailNotifier;
import com.secpipe.orchestrator.publish.DocumentationClient;
import com.secpipe.orchestrator.publish.ReportPublisher;
import com.secpipe.orchestrator.resource.EphemeralResourceGuard;
import com.secpipe.orchestrator.resource.ReadinessProbe;
import com.secpipe.orchestrator.tool.ToolInvoker;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Clock;

/**
 * Wires the pipeline components from {@link PipelineProperties}.
 *
 * The components themselves are plain classes so they can be unit-tested
 * without a Spring context.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    ArtifactStore artifactStore(PipelineProperties props) {
        return new ArtifactStore(props.reportDir());
    }

    @Bean
    VersionCorrelator versionCorrelator(PipelineProperties props, Clock clock) {
        return new VersionCorrelator(props.versionFile(), props.reportBasename(), clock);
    }

    @Bean
    DocumentationClient documentationClient(PipelineProperties props, ObjectMapper objectMapper) {
        return new DocumentationClient(props.documentation(), objectMapper);
    }

    @Bean
    ReportPublisher reportPublisher(DocumentationClient client, PipelineProperties props) {
        return new ReportPublisher(client, props.reportTitle());
    }

    @Bean
    MailNotifier mailNotifier(JavaMailSender mailSender, PipelineProperties props) {
        return new MailNotifier(mailSender, props.mail().from());
    }

    // Containers still running at shutdown are removed with the context.
    @Bean(destroyMethod = "releaseAll")
    EphemeralResourceGuard ephemeralResourceGuard(ToolInvoker tools, ReadinessProbe probe,
                                                  PipelineProperties props, Clock clock) {
        PipelineProperties.Dast dast = props.dast();
        return new EphemeralResourceGuard(tools, probe, dast.healthPath(),
                dast.readinessTimeout(), dast.pollInterval(), clock);
    }
}
