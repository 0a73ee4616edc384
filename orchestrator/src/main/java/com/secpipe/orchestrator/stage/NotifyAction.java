package com.secpipe.orchestrator.stage;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.notify.MailNotifier;
import com.secpipe.orchestrator.notify.NotificationException;
import com.secpipe.orchestrator.notify.ReportMessages;
import com.secpipe.orchestrator.pipeline.ActionResult;
import com.secpipe.orchestrator.pipeline.StageAction;
import com.secpipe.orchestrator.pipeline.StageContext;
import com.secpipe.orchestrator.publish.PublishedLink;
import com.secpipe.orchestrator.publish.ReportPublisher;

import java.util.List;

/**
 * E-mails the run summary with the report files attached.
 *
 * Uses the link found by the publish stage; when that stage did not run,
 * the link is looked up here.
 */
public class NotifyAction implements StageAction {

    private final MailNotifier    notifier;
    private final ReportPublisher publisher;
    private final List<String>    recipients;
    private final String          reportTitle;
    private final String          spaceKey;

    public NotifyAction(MailNotifier notifier, ReportPublisher publisher, List<String> recipients,
                        String reportTitle, String spaceKey) {
        this.notifier    = notifier;
        this.publisher   = publisher;
        this.recipients  = recipients;
        this.reportTitle = reportTitle;
        this.spaceKey    = spaceKey;
    }

    @Override
    public ActionResult execute(StageContext context) {
        if (context.versionRecord().isEmpty()) {
            return ActionResult.failed(CommandStageAction.MISSING_INPUT_EXIT_CODE,
                    "required input missing: no version record for this run");
        }
        VersionRecord record = context.versionRecord().get();
        PublishedLink link = context.publishedLink().orElseGet(() -> {
            PublishedLink resolved = publisher.resolveLink(record.version(), record.status(), spaceKey);
            context.recordPublishedLink(resolved);
            return resolved;
        });

        List<ArtifactRef> attachments = context.producedArtifacts();
        try {
            notifier.send(recipients,
                    ReportMessages.subject(reportTitle, record),
                    ReportMessages.body(reportTitle, record, context.results(), attachments),
                    link.url(),
                    attachments);
        } catch (NotificationException e) {
            return ActionResult.failed(1, e.getMessage());
        }
        return ActionResult.ok("sent to " + recipients.size() + " recipient(s)", null);
    }
}
