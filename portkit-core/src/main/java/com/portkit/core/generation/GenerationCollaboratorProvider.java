package com.portkit.core.generation;

import com.portkit.core.config.PortkitConfig.GenerationSettings;

import java.nio.file.Path;

/**
 * Service Provider Interface for generation collaborator backends.
 *
 * <p>Backends are discovered via {@link java.util.ServiceLoader} and selected by
 * the {@code generation.backend} configuration value.
 *
 * <p><b>Registration:</b> list the implementation class in
 * {@code META-INF/services/com.portkit.core.generation.GenerationCollaboratorProvider}.
 */
public interface GenerationCollaboratorProvider {

    /**
     * @return backend id matched against {@code generation.backend}
     */
    String getId();

    /**
     * @return human-readable backend name
     */
    String getDisplayName();

    /**
     * Creates a collaborator.
     *
     * @param settings generation settings
     * @param projectDir target project directory
     * @return configured collaborator
     * @throws IllegalArgumentException if the settings are incomplete for this backend
     */
    GenerationCollaborator create(GenerationSettings settings, Path projectDir);
}
