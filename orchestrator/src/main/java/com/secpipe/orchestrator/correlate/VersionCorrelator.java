package com.secpipe.orchestrator.correlate;

import com.secpipe.orchestrator.artifact.ArtifactStore;
import com.secpipe.orchestrator.artifact.ArtifactStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the version number and pass/fail status of a run.
 *
 * <p>Versions come from two places in the artifact store: the version file
 * written by the previous run, and the numbered report artifacts
 * ({@code <basename>_v<N>.*}) already on disk. The next version is one more
 * than the largest of either, so a deleted or stale version file can never
 * make a run reuse a number.
 *
 * <p>Status is a plain-text heuristic over the test runner's output: any
 * occurrence of "failed" (any case) means FAIL. It does not parse a
 * structured result, so a test named {@code test_failed_login} that passes
 * still reads as FAIL.
 */
public class VersionCorrelator {

    private static final Logger log = LoggerFactory.getLogger(VersionCorrelator.class);

    static final String FAILURE_TOKEN = "failed";

    private final Path    versionFile;
    private final Pattern versionedArtifact;
    private final Clock   clock;

    public VersionCorrelator(Path versionFile, String reportBasename, Clock clock) {
        this.versionFile       = versionFile;
        this.versionedArtifact = Pattern.compile(Pattern.quote(reportBasename) + "_v(\\d+)\\.[A-Za-z]+");
        this.clock             = clock;
    }

    /**
     * @param priorVersions versions already recorded in the store (may be empty)
     * @param testOutput    captured test-runner output of this run, {@code null} if none
     */
    public VersionRecord correlate(Collection<Integer> priorVersions, String testOutput) {
        VersionRecord record = new VersionRecord(
                nextVersion(priorVersions), deriveStatus(testOutput), clock.instant());
        log.info("Correlated run as v{} ({})", record.version(), record.status());
        return record;
    }

    public static int nextVersion(Collection<Integer> priorVersions) {
        return priorVersions.stream()
                .mapToInt(Integer::intValue)
                .max()
                .orElse(0) + 1;
    }

    public static ReportStatus deriveStatus(String testOutput) {
        if (testOutput == null || testOutput.isBlank()) {
            return ReportStatus.UNKNOWN;
        }
        return testOutput.toLowerCase(Locale.ROOT).contains(FAILURE_TOKEN)
                ? ReportStatus.FAIL
                : ReportStatus.PASS;
    }

    /** Every version observable in the store: the version file plus numbered artifacts. */
    public List<Integer> priorVersions(ArtifactStore store) {
        List<Integer> versions = new ArrayList<>();
        readVersionFile().ifPresent(versions::add);
        for (String name : store.names()) {
            Matcher m = versionedArtifact.matcher(name);
            if (m.matches()) {
                versions.add(Integer.parseInt(m.group(1)));
            }
        }
        return versions;
    }

    /** Write the record's version as the new content of the version file. */
    public void persist(VersionRecord record) {
        try {
            Path parent = versionFile.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.writeString(versionFile, Integer.toString(record.version()), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot write version file " + versionFile, e);
        }
    }

    private Optional<Integer> readVersionFile() {
        if (!Files.isRegularFile(versionFile)) {
            return Optional.empty();
        }
        try {
            String text = Files.readString(versionFile, StandardCharsets.UTF_8).strip();
            return Optional.of(Integer.parseInt(text));
        } catch (NumberFormatException e) {
            log.warn("Ignoring unreadable version file {}: {}", versionFile, e.getMessage());
            return Optional.empty();
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot read version file " + versionFile, e);
        }
    }
}
