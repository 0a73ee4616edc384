package com.secpipe.orchestrator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything a pipeline run needs to know about its environment, bound from
 * the {@code secpipe.*} keys of application.yml and the process environment.
 *
 * Components receive the part they need through their constructor; nothing
 * reads environment variables directly.
 *
 * @param workspace     checkout of the application under test; tools run here
 * @param reportDir     artifact directory, relative paths resolve against {@code workspace}
 * @param versionFile   plain-text file holding the last issued version; a bare file
 *                      name lives in {@code reportDir}, other relative paths resolve
 *                      against {@code workspace}
 * @param reportTitle   heading of the summary report and prefix of the published page title
 * @param toggles       default enablement per toggle name; a run may override these
 * @param fatalStages   stages whose non-zero exit aborts the run
 * @param tools         command stage settings keyed by stage name
 * @param pdfCommand    html-to-pdf converter; the html and pdf paths are appended
 * @param runOnStartup  run one pipeline at start-up and exit with its status
 */
@ConfigurationProperties(prefix = "secpipe")
public record PipelineProperties(
        Path                      workspace,
        Path                      reportDir,
        Path                      versionFile,
        String                    reportBasename,
        String                    reportTitle,
        Map<String, Boolean>      toggles,
        Set<String>               fatalStages,
        Map<String, ToolSettings> tools,
        List<String>              pdfCommand,
        Duration                  pdfTimeout,
        Image                     image,
        Dast                      dast,
        Documentation             documentation,
        Mail                      mail,
        boolean                   runOnStartup
) {

    public PipelineProperties {
        if (workspace == null)      workspace = Path.of(".");
        if (reportDir == null)      reportDir = Path.of("report");
        if (!reportDir.isAbsolute()) reportDir = workspace.resolve(reportDir);
        if (versionFile == null)    versionFile = reportDir.resolve("version.txt");
        if (!versionFile.isAbsolute() && versionFile.getNameCount() == 1) {
            versionFile = reportDir.resolve(versionFile);
        } else if (!versionFile.isAbsolute()) {
            versionFile = workspace.resolve(versionFile);
        }
        if (reportBasename == null || reportBasename.isBlank()) reportBasename = "test_result_report";
        if (reportTitle == null || reportTitle.isBlank())       reportTitle = "Test Result Report";
        toggles     = toggles == null ? Map.of() : new LinkedHashMap<>(toggles);
        fatalStages = fatalStages == null ? Set.of("prepare", "environment-setup", "image-build") : Set.copyOf(fatalStages);
        tools       = tools == null ? Map.of() : Map.copyOf(tools);
        pdfCommand  = pdfCommand == null ? List.of() : List.copyOf(pdfCommand);
        if (pdfTimeout == null)    pdfTimeout = Duration.ofMinutes(2);
        if (image == null)         image = new Image(null, null);
        if (dast == null)          dast = new Dast(null, null, 0, 0, null, null, null, null, null, null);
        if (documentation == null) documentation = new Documentation(null, null, null, null, null);
        if (mail == null)          mail = new Mail(null, null);
    }

    /**
     * Settings of one command stage.
     *
     * @param requiredFiles workspace-relative inputs that must exist before launching
     * @param outputFile    artifact that receives the captured output, if any
     * @param combineOutput write stdout and stderr to {@code outputFile} instead of stdout only
     * @param produces      artifacts the tool writes itself
     */
    public record ToolSettings(
            List<String> command,
            Duration     timeout,
            List<String> requiredFiles,
            String       outputFile,
            boolean      combineOutput,
            List<String> produces
    ) {
        public ToolSettings {
            command       = command == null ? List.of() : List.copyOf(command);
            if (timeout == null) timeout = Duration.ofMinutes(15);
            requiredFiles = requiredFiles == null ? List.of() : List.copyOf(requiredFiles);
            produces      = produces == null ? List.of() : List.copyOf(produces);
        }

        /** Copy that additionally requires {@code file}; unchanged if already required. */
        public ToolSettings requiring(String file) {
            if (requiredFiles.contains(file)) return this;
            List<String> files = new ArrayList<>(requiredFiles);
            files.add(file);
            return new ToolSettings(command, timeout, files, outputFile, combineOutput, produces);
        }
    }

    public record Image(String tag, String dockerfile) {
        public Image {
            if (tag == null || tag.isBlank())               tag = "secpipe-app:latest";
            if (dockerfile == null || dockerfile.isBlank()) dockerfile = "Dockerfile";
        }
    }

    /**
     * Ephemeral deployment and baseline scan used for dynamic testing.
     *
     * @param readinessTimeout upper bound for the health poll after the container starts
     */
    public record Dast(
            String   network,
            String   container,
            int      hostPort,
            int      containerPort,
            String   healthPath,
            Duration readinessTimeout,
            Duration pollInterval,
            String   scannerImage,
            Duration scanTimeout,
            String   reportName
    ) {
        public Dast {
            if (network == null || network.isBlank())           network = "secpipe-dast";
            if (container == null || container.isBlank())       container = "secpipe-app-under-test";
            if (hostPort <= 0)                                  hostPort = 5000;
            if (containerPort <= 0)                             containerPort = 5000;
            if (healthPath == null || healthPath.isBlank())     healthPath = "/health";
            if (readinessTimeout == null)                       readinessTimeout = Duration.ofSeconds(60);
            if (pollInterval == null)                           pollInterval = Duration.ofSeconds(2);
            if (scannerImage == null || scannerImage.isBlank()) scannerImage = "ghcr.io/zaproxy/zaproxy:stable";
            if (scanTimeout == null)                            scanTimeout = Duration.ofMinutes(20);
            if (reportName == null || reportName.isBlank())     reportName = "zap_dast_report.html";
        }
    }

    /**
     * Documentation system (Confluence REST API) the report page is published to.
     * An empty {@code baseUrl} disables publishing; links then fall back to nothing.
     */
    public record Documentation(
            String baseUrl,
            String user,
            String token,
            String spaceKey,
            Duration timeout
    ) {
        public Documentation {
            baseUrl = baseUrl == null ? "" : baseUrl.strip().replaceAll("/+$", "");
            if (spaceKey == null || spaceKey.isBlank()) spaceKey = "DEMO";
            if (timeout == null)                        timeout = Duration.ofSeconds(30);
        }

        public boolean configured() {
            return !baseUrl.isEmpty();
        }
    }

    /** Sender and recipients of the run notification; SMTP itself is spring.mail.*. */
    public record Mail(String from, List<String> to) {
        public Mail {
            to = to == null ? List.of() : to.stream().map(String::strip).filter(s -> !s.isEmpty()).toList();
        }
    }
}
