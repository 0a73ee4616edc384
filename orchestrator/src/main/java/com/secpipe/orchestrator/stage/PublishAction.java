package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.publish.DocumentationException;
import com.secpipe.orchestrator.publish.PublishReceipt;
import com.secpipe.orchestrator.publish.PublishedLink;
import com.secpipe.orchestrator.publish.ReportPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Publishes the report page with the run's artifacts attached, then resolves
 * the link the notification will carry.
 *
 * The link is resolved whether or not publishing worked; a failed publish
 * only fails this stage.
 */
public class PublishAction implements StageAction {

    private static final Logger log = LoggerFactory.getLogger(PublishAction.class);

    private final ReportPublisher publisher;
    private final String          spaceKey;

    public PublishAction(ReportPublisher publisher, String spaceKey) {
        this.publisher = publisher;
        this.spaceKey  = spaceKey;
    }

    @Override
    public ActionResult execute(StageContext context) {
        if (context.versionRecord().isEmpty()) {
            return ActionResult.failed(CommandStageAction.MISSING_INPUT_EXIT_CODE,
                    "required input missing: no version record for this run");
        }
        VersionRecord record = context.versionRecord().get();
        List<ArtifactRef> attachments = context.producedArtifacts();

        int exitCode = 0;
        String detail;
        try {
            PublishReceipt receipt = publisher.publish(record, spaceKey, attachments);
            detail = (receipt.created() ? "created" : "updated") + " page " + receipt.pageId()
                    + ", " + receipt.uploaded().size() + " attachment(s)";
            if (!receipt.complete()) {
                exitCode = 1;
                detail += ", failed uploads: " + String.join(", ", receipt.failed());
            }
        } catch (DocumentationException e) {
            log.warn("Publishing v{} failed: {}", record.version(), e.getMessage());
            exitCode = 1;
            detail = "publish failed: " + e.getMessage();
        }

        PublishedLink link = publisher.resolveLink(record.version(), record.status(), spaceKey);
        context.recordPublishedLink(link);
        return new ActionResult(exitCode, detail, List.of());
    }
}
