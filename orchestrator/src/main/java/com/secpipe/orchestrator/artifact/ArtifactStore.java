package com.secpipe.orchestrator.artifact;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Directory that holds the named report files of a pipeline run.
 *
 * One run owns the directory at a time; the store does no locking of its own.
 * Names are flat file names relative to the root; anything resolving outside
 * the root is rejected.
 */
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path root;

    public ArtifactStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }

    /** Create the directory if needed. */
    public void ensureExists() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot create artifact directory " + root, e);
        }
    }

    public Path resolve(String name) {
        Path path = root.resolve(name).normalize();
        if (!path.startsWith(root)) {
            throw new ArtifactStoreException("Artifact name escapes the store: " + name);
        }
        return path;
    }

    public ArtifactRef write(String name, String content) {
        Path path = resolve(name);
        try {
            ensureExists();
            Files.writeString(path, content == null ? "" : content, StandardCharsets.UTF_8);
            log.debug("Wrote artifact {} ({} chars)", name, content == null ? 0 : content.length());
            return ArtifactRef.of(path);
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot write artifact " + name, e);
        }
    }

    /**
     * Read a text artifact; malformed bytes are replaced rather than failing,
     * since scanner output is not always valid UTF-8.
     */
    public Optional<String> read(String name) {
        Path path = resolve(name);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new String(Files.readAllBytes(path), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot read artifact " + name, e);
        }
    }

    public ArtifactRef ref(String name) {
        return ArtifactRef.of(resolve(name));
    }

    /** References for the given names that currently exist, in the given order. */
    public List<ArtifactRef> existing(Collection<String> names) {
        return names.stream()
                .map(this::ref)
                .filter(ArtifactRef::exists)
                .toList();
    }

    /** Names of all regular files in the store, sorted. */
    public List<String> names() {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(root)) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArtifactStoreException("Cannot list artifact directory " + root, e);
        }
    }
}
