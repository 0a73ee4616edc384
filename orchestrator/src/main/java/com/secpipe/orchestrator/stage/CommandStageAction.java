package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.config.PipelineProperties.ToolSettings;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.tool.ToolInvoker;
import com.secpipe.orchestrator.tool.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one external tool as a stage.
 *
 * Steps:
 *  1. Check the required input files exist in the workspace; if one is missing
 *     the tool is not launched and the stage exits 2
 *  2. Run the command in the workspace under its timeout
 *  3. Save the captured output to {@code outputFile}, if configured
 *  4. Report {@code outputFile} and every file the tool was expected to produce
 *
 * The tool's own exit code becomes the stage's exit code.
 */
public class CommandStageAction implements StageAction {

    private static final Logger log = LoggerFactory.getLogger(CommandStageAction.class);

    /** Exit code of a stage that did not launch because its input is absent. */
    public static final int MISSING_INPUT_EXIT_CODE = 2;

    private final String       stage;
    private final ToolSettings settings;
    private final ToolInvoker  tools;
    private final Path         workspace;
    private final boolean      recordsTestOutput;

    public CommandStageAction(String stage, ToolSettings settings, ToolInvoker tools,
                              Path workspace, boolean recordsTestOutput) {
        this.stage             = stage;
        this.settings          = settings;
        this.tools             = tools;
        this.workspace         = workspace;
        this.recordsTestOutput = recordsTestOutput;
    }

    @Override
    public ActionResult execute(StageContext context) {
        if (settings.command().isEmpty()) {
            return ActionResult.failed(MISSING_INPUT_EXIT_CODE, "no command configured for stage " + stage);
        }
        for (String required : settings.requiredFiles()) {
            if (!Files.exists(workspace.resolve(required))) {
                log.warn("Stage '{}' not started: {} not found in {}", stage, required, workspace);
                return ActionResult.failed(MISSING_INPUT_EXIT_CODE, "required input missing: " + required);
            }
        }

        ArtifactStore store = context.artifacts();
        store.ensureExists();
        ToolResult result = tools.invoke(settings.command(), workspace, Map.of(), settings.timeout());

        List<ArtifactRef> artifacts = new ArrayList<>();
        if (settings.outputFile() != null && !settings.outputFile().isBlank()) {
            String captured = settings.combineOutput() ? result.combinedOutput() : result.stdout();
            artifacts.add(store.write(settings.outputFile(), captured));
        }
        for (String produced : settings.produces()) {
            ArtifactRef ref = store.ref(produced);
            if (!ref.exists()) {
                log.warn("Stage '{}' did not produce {}", stage, produced);
            }
            artifacts.add(ref);
        }
        if (recordsTestOutput) {
            context.recordTestOutput(result.combinedOutput());
        }

        String detail = result.success()
                ? "completed in " + result.elapsed().toMillis() + " ms"
                : result.summaryLine();
        return new ActionResult(result.exitCode(), detail, artifacts);
    }
}
