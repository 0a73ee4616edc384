package com.secpipe.orchestrator.notify;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.correlate.VersionRecord;
import com.secpipe.orchestrator.pipeline.StageResult;
import org.springframework.web.util.HtmlUtils;

import java.util.List;

/**
 * Subject and body of the run notification.
 *
 * Every stage of the run is listed, including skipped ones.
 */
public final class ReportMessages {

    private ReportMessages() {}

    public static String subject(String reportTitle, VersionRecord record) {
        return "%s v%d (%s)".formatted(reportTitle, record.version(), record.status().name());
    }

    public static String body(String reportTitle, VersionRecord record,
                              List<StageResult> stages, List<ArtifactRef> attachments) {
        StringBuilder sb = new StringBuilder();
        sb.append("<html><body style=\"font-family: Arial, sans-serif;\">");
        sb.append("<h2>").append(HtmlUtils.htmlEscape(subject(reportTitle, record))).append("</h2>");
        sb.append("<p><b>Version:</b> ").append(record.version())
          .append(" &nbsp; <b>Status:</b> ").append(record.status().name()).append("</p>");

        sb.append("<table border=\"1\" cellpadding=\"4\" cellspacing=\"0\">");
        sb.append("<tr><th>Stage</th><th>Result</th><th>Exit code</th><th>Detail</th></tr>");
        for (StageResult stage : stages) {
            sb.append("<tr><td>").append(HtmlUtils.htmlEscape(stage.name()))
              .append("</td><td>").append(stage.outcome().name())
              .append("</td><td>").append(stage.exitCode() == null ? "-" : stage.exitCode())
              .append("</td><td>").append(stage.detail() == null ? "" : HtmlUtils.htmlEscape(stage.detail()))
              .append("</td></tr>");
        }
        sb.append("</table>");

        List<ArtifactRef> present = attachments.stream().filter(ArtifactRef::exists).toList();
        if (!present.isEmpty()) {
            sb.append("<p><b>Attached files:</b></p><ul>");
            for (ArtifactRef a : present) {
                sb.append("<li>").append(HtmlUtils.htmlEscape(a.name())).append("</li>");
            }
            sb.append("</ul>");
        }
        sb.append("<p><i>This message was sent automatically by the DevSecOps pipeline.</i></p>");
        sb.append("</body></html>");
        return sb.toString();
    }
}
