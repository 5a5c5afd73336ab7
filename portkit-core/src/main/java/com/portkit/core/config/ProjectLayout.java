package com.portkit.core.config;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Absolute locations derived from a configuration and the directory it was loaded from.
 *
 * @param baseDir directory containing the configuration file
 * @param projectDir target project directory
 * @param factsPath parsed-facts document
 * @param checkpointDir checkpoint store directory
 * @param artifactsDir artifact workspace root
 * @param reportDir run report directory
 */
public record ProjectLayout(
    Path baseDir,
    Path projectDir,
    Path factsPath,
    Path checkpointDir,
    Path artifactsDir,
    Path reportDir
) {
    /**
     * Compact constructor with validation.
     */
    public ProjectLayout {
        Objects.requireNonNull(baseDir, "baseDir must not be null");
        Objects.requireNonNull(projectDir, "projectDir must not be null");
        Objects.requireNonNull(factsPath, "factsPath must not be null");
        Objects.requireNonNull(checkpointDir, "checkpointDir must not be null");
        Objects.requireNonNull(artifactsDir, "artifactsDir must not be null");
        Objects.requireNonNull(reportDir, "reportDir must not be null");
    }

    /**
     * Resolves every configured path against the configuration's directory.
     *
     * @param config loaded configuration
     * @param baseDir directory containing the configuration file
     * @return resolved layout
     */
    public static ProjectLayout of(PortkitConfig config, Path baseDir) {
        Path base = baseDir.toAbsolutePath().normalize();
        return new ProjectLayout(
            base,
            PortkitConfig.resolve(base, config.project().directory()),
            PortkitConfig.resolve(base, config.facts().path()),
            PortkitConfig.resolve(base, config.checkpoint().directory()),
            PortkitConfig.resolve(base, config.artifacts().directory()),
            PortkitConfig.resolve(base, config.report().directory())
        );
    }
}
