package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.artifact.ArtifactKind;
import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.correlate.ReportGenerator;
import com.secpipe.orchestrator.correlate.SecuritySummary;
import com.secpipe.orchestrator.correlate.TestSummary;
import com.secpipe.orchestrator.correlate.VersionCorrelator;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.tool.ToolInvoker;
import com.secpipe.orchestrator.tool.ToolLaunchException;
import com.secpipe.orchestrator.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Binds this run to a version and status and writes the versioned report.
 *
 * Steps:
 *  1. Compute the VersionRecord once for the run from the versions already in
 *     the store and this run's test output
 *  2. Write the new version to the version file
 *  3. Render {@code <basename>_v<N>.html} from the test and scanner outputs
 *  4. Convert it to {@code <basename>_v<N>.pdf}; a converter that fails or cannot be
 *     launched fails the stage but the HTML report stays
 */
public class CorrelateAction implements StageAction {

    private static final Logger log = LoggerFactory.getLogger(CorrelateAction.class);

    private final VersionCorrelator correlator;
    private final ToolInvoker       tools;
    private final String            reportTitle;
    private final String            reportBasename;
    private final List<String>      pdfCommand;
    private final Duration          pdfTimeout;

    public CorrelateAction(VersionCorrelator correlator, ToolInvoker tools, String reportTitle,
                           String reportBasename, List<String> pdfCommand, Duration pdfTimeout) {
        this.correlator     = correlator;
        this.tools          = tools;
        this.reportTitle    = reportTitle;
        this.reportBasename = reportBasename;
        this.pdfCommand     = pdfCommand;
        this.pdfTimeout     = pdfTimeout;
    }

    @Override
    public ActionResult execute(StageContext context) {
        ArtifactStore store = context.artifacts();
        String testOutput = context.testOutput().orElse(null);

        VersionRecord record = context.stampVersion(
                () -> correlator.correlate(correlator.priorVersions(store), testOutput));
        correlator.persist(record);

        String html = ReportGenerator.render(reportTitle, record,
                testOutput == null ? TestSummary.EMPTY : TestSummary.parse(testOutput),
                SecuritySummary.collect(store));
        ArtifactRef htmlRef = store.write(record.artifactName(reportBasename, ArtifactKind.HTML), html);

        List<ArtifactRef> artifacts = new ArrayList<>();
        artifacts.add(htmlRef);
        String summary = "v" + record.version() + " (" + record.status() + ")";
        if (pdfCommand.isEmpty()) {
            log.info("No PDF converter configured, keeping HTML report only");
            return ActionResult.ok(summary, artifacts);
        }

        Path pdf = store.resolve(record.artifactName(reportBasename, ArtifactKind.PDF));
        List<String> command = new ArrayList<>(pdfCommand);
        command.add(htmlRef.path().toString());
        command.add(pdf.toString());
        ToolResult result;
        try {
            result = tools.invoke(command, store.root(), Map.of(), pdfTimeout);
        } catch (ToolLaunchException e) {
            log.warn("PDF converter could not be launched, keeping HTML report only: {}", e.getMessage());
            return new ActionResult(ToolLaunchException.EXIT_CODE,
                    summary + ", PDF conversion failed: " + e.getMessage(), artifacts);
        }

        artifacts.add(ArtifactRef.of(pdf));
        if (!result.success()) {
            return new ActionResult(result.exitCode(),
                    summary + ", PDF conversion failed: " + result.summaryLine(), artifacts);
        }
        return ActionResult.ok(summary, artifacts);
    }
}
