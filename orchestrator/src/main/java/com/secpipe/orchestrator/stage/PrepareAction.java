package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * First stage of every run: the workspace must exist and the artifact
 * directory is created if needed.
 */
public class PrepareAction implements StageAction {

    private final Path workspace;

    public PrepareAction(Path workspace) {
        this.workspace = workspace;
    }

    @Override
    public ActionResult execute(StageContext context) {
        if (!Files.isDirectory(workspace)) {
            return ActionResult.failed(CommandStageAction.MISSING_INPUT_EXIT_CODE,
                    "required input missing: workspace " + workspace);
        }
        context.artifacts().ensureExists();
        return ActionResult.ok("artifacts in " + context.artifacts().root(), null);
    }
}
