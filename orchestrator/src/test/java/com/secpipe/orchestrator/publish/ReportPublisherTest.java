package com.secpipe.orchestrator.publish;

import com.secpipe.orchestrator.artifact.ArtifactRef;
import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.correlate.ReportStatus;
import com.secpipe.orchestrator.correlate.VersionRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for ReportPublisher with the documentation client mocked.
 */
@ExtendWith(MockitoExtension.class)
class ReportPublisherTest {

    private static final String BASE = "https://docs.example.com/wiki";

    @Mock DocumentationClient client;

    @TempDir Path tmp;

    ReportPublisher publisher;

    @BeforeEach
    void setUp() {
        publisher = new ReportPublisher(client, "Test Result Report");
    }

    // ------------------------------------------------------------------
    // resolveLink()
    // ------------------------------------------------------------------

    @Test
    void pageTitle_followsTitleVersionStatusPattern() {
        assertThat(publisher.pageTitle(7, ReportStatus.PASS)).isEqualTo("Test Result Report v7 (PASS)");
    }

    @Test
    void resolveLink_exactlyOneMatch_returnsDirectPageLink() {
        configured();
        when(client.searchByTitle("DEMO", "Test Result Report v7 (PASS)"))
                .thenReturn(List.of(new PageSummary("123", "Test Result Report v7 (PASS)", 2)));

        PublishedLink link = publisher.resolveLink(7, ReportStatus.PASS, "DEMO");

        assertThat(link.isResolved()).isTrue();
        assertThat(link.url()).isEqualTo(BASE + "/pages/123/Test+Result+Report+v7+(PASS)");
        assertThat(link.fallbackUrl()).isEqualTo(BASE + "/spaces/DEMO");
    }

    @Test
    void resolveLink_zeroMatches_fallsBackToSpaceRoot() {
        configured();
        when(client.searchByTitle("DEMO", "Test Result Report v7 (PASS)")).thenReturn(List.of());

        PublishedLink link = publisher.resolveLink(7, ReportStatus.PASS, "DEMO");

        assertThat(link.isResolved()).isFalse();
        assertThat(link.url()).isEqualTo(BASE + "/spaces/DEMO");
    }

    @Test
    void resolveLink_ambiguousTitle_fallsBackToSpaceRoot() {
        configured();
        when(client.searchByTitle(anyString(), anyString())).thenReturn(List.of(
                new PageSummary("1", "Test Result Report v7 (FAIL)", 1),
                new PageSummary("2", "Test Result Report v7 (FAIL)", 1)));

        PublishedLink link = publisher.resolveLink(7, ReportStatus.FAIL, "DEMO");

        assertThat(link.resolved()).isEmpty();
        assertThat(link.url()).isEqualTo(BASE + "/spaces/DEMO");
    }

    @Test
    void resolveLink_searchFails_fallsBackWithoutThrowing() {
        configured();
        when(client.searchByTitle(anyString(), anyString()))
                .thenThrow(new DocumentationException("search failed: HTTP 401: Unauthorized"));

        PublishedLink link = publisher.resolveLink(7, ReportStatus.PASS, "DEMO");

        assertThat(link.url()).isEqualTo(BASE + "/spaces/DEMO");
    }

    @Test
    void resolveLink_notConfigured_returnsEmptyFallbackWithoutCalls() {
        when(client.isConfigured()).thenReturn(false);

        PublishedLink link = publisher.resolveLink(7, ReportStatus.PASS, "DEMO");

        assertThat(link.url()).isEmpty();
        verify(client, never()).searchByTitle(anyString(), anyString());
    }

    // ------------------------------------------------------------------
    // publish()
    // ------------------------------------------------------------------

    @Test
    void publish_noExistingPage_createsAndUploadsExistingArtifacts() {
        ArtifactStore store = new ArtifactStore(tmp);
        ArtifactRef html    = store.write("test_result_report_v3.html", "<html/>");
        ArtifactRef missing = store.ref("test_result_report_v3.pdf");
        when(client.searchByTitle("DEMO", "Test Result Report v3 (FAIL)")).thenReturn(List.of());
        when(client.createPage(eq("DEMO"), eq("Test Result Report v3 (FAIL)"), anyString())).thenReturn("555");

        PublishReceipt receipt = publisher.publish(record(3, ReportStatus.FAIL), "DEMO", List.of(html, missing));

        assertThat(receipt.pageId()).isEqualTo("555");
        assertThat(receipt.created()).isTrue();
        assertThat(receipt.uploaded()).containsExactly("test_result_report_v3.html");
        assertThat(receipt.complete()).isTrue();
        verify(client).uploadAttachment("555", html.path());
        verify(client, never()).uploadAttachment(anyString(), eq(missing.path()));
    }

    @Test
    void publish_existingPages_updatesFirstMatch() {
        PageSummary first = new PageSummary("10", "Test Result Report v3 (PASS)", 4);
        when(client.searchByTitle(anyString(), anyString()))
                .thenReturn(List.of(first, new PageSummary("11", "Test Result Report v3 (PASS)", 1)));

        PublishReceipt receipt = publisher.publish(record(3, ReportStatus.PASS), "DEMO", List.of());

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(client).updatePage(eq(first), body.capture());
        verify(client, never()).createPage(anyString(), anyString(), anyString());
        assertThat(receipt.created()).isFalse();
        assertThat(receipt.pageId()).isEqualTo("10");
        assertThat(body.getValue()).contains("<b>Version:</b> 3").contains("PASS");
    }

    @Test
    void publish_uploadFails_isRecordedAndOthersContinue() {
        ArtifactStore store = new ArtifactStore(tmp);
        ArtifactRef a = store.write("bandit_report.html", "<html/>");
        ArtifactRef b = store.write("trivy_report.txt", "ok");
        when(client.searchByTitle(anyString(), anyString())).thenReturn(List.of());
        when(client.createPage(anyString(), anyString(), anyString())).thenReturn("9");
        doThrow(new DocumentationException("upload bandit_report.html failed: HTTP 413: too large"))
                .when(client).uploadAttachment("9", a.path());

        PublishReceipt receipt = publisher.publish(record(1, ReportStatus.PASS), "DEMO", List.of(a, b));

        assertThat(receipt.failed()).containsExactly("bandit_report.html");
        assertThat(receipt.uploaded()).containsExactly("trivy_report.txt");
        assertThat(receipt.complete()).isFalse();
    }

    @Test
    void publish_pageCannotBeWritten_throws() {
        when(client.searchByTitle(anyString(), anyString()))
                .thenThrow(new DocumentationException("Documentation base URL is not configured"));

        assertThatThrownBy(() -> publisher.publish(record(1, ReportStatus.PASS), "DEMO", List.of()))
                .isInstanceOf(DocumentationException.class);
        verify(client, never()).uploadAttachment(anyString(), any());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void configured() {
        when(client.isConfigured()).thenReturn(true);
        when(client.baseUrl()).thenReturn(BASE);
    }

    private static VersionRecord record(int version, ReportStatus status) {
        return new VersionRecord(version, status, Instant.parse("2026-03-01T10:00:00Z"));
    }
}
