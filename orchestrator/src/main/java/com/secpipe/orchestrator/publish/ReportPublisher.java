package com.secpipe.orchestrator.publish;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.correlate.ReportStatus;
import com.secpipe.orchestrator.correlate.VersionRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.util.HtmlUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Publishes a run's report page and resolves a durable link to it.
 *
 * <p>Pages are correlated with runs purely by title,
 * {@code "<report title> v<version> (<status>)"}. Titles are not unique keys
 * in the documentation system, so link resolution treats anything other than
 * exactly one hit as unresolved and hands back the space root instead.
 *
 * <p>{@link #resolveLink} never throws: a broken link must not abort the run.
 */
public class ReportPublisher {

    private static final Logger log = LoggerFactory.getLogger(ReportPublisher.class);

    private final DocumentationClient client;
    private final String              reportTitle;

    public ReportPublisher(DocumentationClient client, String reportTitle) {
        this.client      = client;
        this.reportTitle = reportTitle;
    }

    public String pageTitle(int version, ReportStatus status) {
        return reportTitle + " v" + version + " (" + status.name() + ")";
    }

    /**
     * Look up the page for this version/status.
     *
     * @return a direct page link on exactly one match; otherwise a link carrying only
     *         the space-root fallback (zero or several matches, network or auth failure)
     */
    public PublishedLink resolveLink(int version, ReportStatus status, String spaceKey) {
        PublishedLink fallback = PublishedLink.fallback(fallbackUrl(spaceKey));
        if (!client.isConfigured()) {
            log.info("No documentation system configured, report link left empty");
            return fallback;
        }
        String title = pageTitle(version, status);
        try {
            List<PageSummary> matches = client.searchByTitle(spaceKey, title);
            if (matches.size() == 1) {
                PageSummary page = matches.get(0);
                String url = client.baseUrl() + "/pages/" + page.id() + "/" + page.title().replace(' ', '+');
                log.info("Resolved report link for '{}': {}", title, url);
                return new PublishedLink(url, fallback.fallbackUrl());
            }
            if (matches.isEmpty()) {
                log.warn("No page titled '{}' in space {}, using space link", title, spaceKey);
            } else {
                log.warn("{} pages titled '{}' in space {}, using space link", matches.size(), title, spaceKey);
            }
        } catch (DocumentationException e) {
            log.warn("Report link lookup for '{}' failed, using space link: {}", title, e.getMessage());
        }
        return fallback;
    }

    /**
     * Create or update the run's page and upload the given artifacts to it.
     *
     * When the title search returns several pages, the first one is updated,
     * matching what a human editor would most likely see.
     *
     * @throws DocumentationException if the page itself cannot be written
     */
    public PublishReceipt publish(VersionRecord record, String spaceKey, List<ArtifactRef> attachments) {
        String title = pageTitle(record.version(), record.status());
        String body  = pageBody(record, attachments);

        List<PageSummary> existing = client.searchByTitle(spaceKey, title);
        String pageId;
        boolean created;
        if (existing.isEmpty()) {
            pageId  = client.createPage(spaceKey, title, body);
            created = true;
        } else {
            if (existing.size() > 1) {
                log.warn("{} pages titled '{}', updating {}", existing.size(), title, existing.get(0).id());
            }
            client.updatePage(existing.get(0), body);
            pageId  = existing.get(0).id();
            created = false;
        }

        List<String> uploaded = new ArrayList<>();
        List<String> failed   = new ArrayList<>();
        for (ArtifactRef artifact : attachments) {
            if (!artifact.exists()) continue;
            try {
                client.uploadAttachment(pageId, artifact.path());
                uploaded.add(artifact.name());
            } catch (DocumentationException e) {
                log.warn("Could not upload {} to page {}: {}", artifact.name(), pageId, e.getMessage());
                failed.add(artifact.name());
            }
        }
        return new PublishReceipt(pageId, created, List.copyOf(uploaded), List.copyOf(failed));
    }

    String fallbackUrl(String spaceKey) {
        return client.isConfigured() ? client.baseUrl() + "/spaces/" + spaceKey : "";
    }

    private String pageBody(VersionRecord record, List<ArtifactRef> attachments) {
        StringBuilder items = new StringBuilder();
        for (ArtifactRef a : attachments) {
            if (a.exists()) {
                items.append("<li>").append(HtmlUtils.htmlEscape(a.name())).append("</li>");
            }
        }
        return """
                <h1>DevSecOps Test &amp; Security Reports</h1>
                <p><b>Version:</b> %d</p>
                <p><b>Status:</b> %s</p>
                <p>Attached artifacts:</p>
                <ul>%s</ul>
                <p><i>Generated automatically by the DevSecOps pipeline.</i></p>
                """.formatted(record.version(), record.status().name(), items);
    }
}
