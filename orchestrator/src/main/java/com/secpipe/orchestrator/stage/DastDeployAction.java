package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.config.PipelineProperties;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageCleanup;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.resource.EphemeralResource;
import com.secpipe.orchestrator.resource.EphemeralResourceGuard;
import com.secpipe.orchestrator.resource.PortMapping;
import com.secpipe.orchestrator.resource.ResourceProvisionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Starts the built image as a throw-away container for dynamic scanning.
 *
 * The deployment is handed to later stages through the context and torn down
 * by {@link #cleanup()}, which the stage table schedules after the scan.
 */
public class DastDeployAction implements StageAction {

    private static final Logger log = LoggerFactory.getLogger(DastDeployAction.class);

    private final EphemeralResourceGuard   guard;
    private final PipelineProperties.Dast  dast;
    private final String                   imageTag;

    public DastDeployAction(EphemeralResourceGuard guard, PipelineProperties.Dast dast, String imageTag) {
        this.guard    = guard;
        this.dast     = dast;
        this.imageTag = imageTag;
    }

    @Override
    public ActionResult execute(StageContext context) {
        try {
            EphemeralResource resource = guard.provision(dast.container(), dast.network(), imageTag,
                    new PortMapping(dast.hostPort(), dast.containerPort()));
            context.recordDeployment(resource);
            return ActionResult.ok("deployed " + imageTag + " as " + resource.networkUrl(), null);
        } catch (ResourceProvisionException e) {
            log.warn("Deployment for dynamic scan failed: {}", e.getMessage());
            return ActionResult.failed(1, e.getMessage());
        }
    }

    /** Release the deployment recorded in the context, if there is one. */
    public StageCleanup cleanup() {
        return context -> context.takeDeployment().ifPresent(guard::release);
    }
}
