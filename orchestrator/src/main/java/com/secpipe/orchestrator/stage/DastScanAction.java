package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.config.PipelineProperties;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.resource.EphemeralResource;
import com.secpipe.orchestrator.tool.ToolInvoker;
import com.secpipe.orchestrator.tool.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Baseline DAST scan of the deployed container.
 *
 * The scanner runs in its own container on the deployment's network and writes
 * its HTML report into the artifact directory through a bind mount.
 */
public class DastScanAction implements StageAction {

    private final ToolInvoker             tools;
    private final PipelineProperties.Dast dast;

    public DastScanAction(ToolInvoker tools, PipelineProperties.Dast dast) {
        this.tools = tools;
        this.dast  = dast;
    }

    @Override
    public ActionResult execute(StageContext context) {
        Optional<EphemeralResource> deployment = context.deployment();
        if (deployment.isEmpty()) {
            return ActionResult.failed(CommandStageAction.MISSING_INPUT_EXIT_CODE,
                    "required input missing: no deployment to scan");
        }
        context.artifacts().ensureExists();
        ToolResult result = tools.invoke(command(deployment.get(), context.artifacts().root().toString()),
                null, Map.of(), dast.scanTimeout());

        ArtifactRef report = context.artifacts().ref(dast.reportName());
        String detail = result.success() ? "no alerts above threshold" : result.summaryLine();
        return new ActionResult(result.exitCode(), detail, List.of(report));
    }

    List<String> command(EphemeralResource target, String reportDir) {
        return List.of("docker", "run", "--rm",
                "--network", target.networkName(),
                "-v", reportDir + ":/zap/wrk:rw",
                dast.scannerImage(),
                "zap-baseline.py", "-t", target.networkUrl(), "-r", dast.reportName());
    }
}
