package com.portkit.core.artifact;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.portkit.core.model.Artifact;
import com.portkit.core.model.ArtifactSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * On-disk home of generated artifact sets.
 *
 * <p>Each unit gets its own directory below the workspace root. Artifacts are
 * written at their relative paths, and a {@code artifacts.json} manifest records
 * the latest set so that verified dependencies can be handed to the collaborator
 * again in a later run.
 *
 * <p><b>Layout:</b>
 * <pre>{@code
 * <root>/
 *   ZopfliGetLengthSymbol/
 *     artifacts.json
 *     src/zopfli_get_length_symbol.rs
 *     fuzz/fuzz_targets/fuzz_ZopfliGetLengthSymbol.rs
 * }</pre>
 */
public class ArtifactWorkspace {

    private static final Logger log = LoggerFactory.getLogger(ArtifactWorkspace.class);
    static final String MANIFEST = "artifacts.json";

    private final Path root;
    private final ObjectMapper mapper;

    public ArtifactWorkspace(Path root) {
        this.root = root;
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * @return workspace root directory
     */
    public Path root() {
        return root;
    }

    /**
     * Directory holding the artifacts of one unit.
     *
     * @param unitId processing unit id
     * @return unit directory (may not exist yet)
     */
    public Path unitDirectory(String unitId) {
        return root.resolve(directoryName(unitId));
    }

    /**
     * Writes an artifact set, replacing the set of a previous attempt. Files listed in
     * the previous manifest are removed first, so no stale artifact outlives its attempt.
     *
     * @param unitId processing unit id
     * @param artifacts artifact set to write
     * @return unit directory
     * @throws IllegalArgumentException if an artifact path escapes the unit directory
     * @throws UncheckedIOException if writing fails
     */
    public Path write(String unitId, ArtifactSet artifacts) {
        Path unitDir = unitDirectory(unitId);
        for (Artifact artifact : artifacts.artifacts()) {
            resolveInside(unitDir, artifact.relativePath());
        }
        try {
            deleteListedFiles(unitId, unitDir);
            Files.createDirectories(unitDir);
            for (Artifact artifact : artifacts.artifacts()) {
                Path target = resolveInside(unitDir, artifact.relativePath());
                Path parentDir = target.getParent();
                if (parentDir != null) {
                    Files.createDirectories(parentDir);
                }
                Files.writeString(target, artifact.content());
                log.debug("Wrote {} artifact for {}: {} ({} chars)",
                    artifact.role().label(), unitId, artifact.relativePath(), artifact.content().length());
            }
            mapper.writeValue(unitDir.resolve(MANIFEST).toFile(), artifacts);
            return unitDir;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write artifacts for unit " + unitId, e);
        }
    }

    /**
     * Reads the last artifact set written for a unit.
     *
     * @param unitId processing unit id
     * @return artifact set, or empty if none was written or the manifest is unreadable
     */
    public Optional<ArtifactSet> read(String unitId) {
        Path manifest = unitDirectory(unitId).resolve(MANIFEST);
        if (!Files.isRegularFile(manifest)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(manifest.toFile(), ArtifactSet.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable artifact manifest {}: {}", manifest, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Removes the artifacts last written for a unit together with its manifest.
     * Files not listed in the manifest are left alone.
     *
     * @param unitId processing unit id
     * @throws UncheckedIOException if a file cannot be deleted
     */
    public void clear(String unitId) {
        Path unitDir = unitDirectory(unitId);
        try {
            deleteListedFiles(unitId, unitDir);
            Files.deleteIfExists(unitDir.resolve(MANIFEST));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to remove artifacts for unit " + unitId, e);
        }
    }

    private void deleteListedFiles(String unitId, Path unitDir) throws IOException {
        Optional<ArtifactSet> previous = read(unitId);
        if (previous.isEmpty()) {
            return;
        }
        for (Artifact artifact : previous.get().artifacts()) {
            Path stale;
            try {
                stale = resolveInside(unitDir, artifact.relativePath());
            } catch (IllegalArgumentException e) {
                log.warn("Not removing {} for {}: {}", artifact.relativePath(), unitId, e.getMessage());
                continue;
            }
            if (Files.deleteIfExists(stale)) {
                log.debug("Removed previous {} artifact for {}: {}", artifact.role().label(), unitId, artifact.relativePath());
            }
        }
    }

    private static Path resolveInside(Path unitDir, String relativePath) {
        Path target = unitDir.resolve(relativePath).normalize();
        if (!target.startsWith(unitDir.normalize()) || Path.of(relativePath).isAbsolute()) {
            throw new IllegalArgumentException("Artifact path escapes unit directory: " + relativePath);
        }
        return target;
    }

    /**
     * Cycle ids and symbol names are used as-is; anything outside a portable
     * file-name alphabet is replaced.
     */
    static String directoryName(String unitId) {
        return unitId.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
