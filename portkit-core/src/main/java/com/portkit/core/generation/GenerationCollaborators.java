package com.portkit.core.generation;

import com.portkit.core.config.PortkitConfig.GenerationSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Discovers collaborator backends via {@link ServiceLoader}.
 */
public final class GenerationCollaborators {

    private static final Logger log = LoggerFactory.getLogger(GenerationCollaborators.class);

    private GenerationCollaborators() {
        // Utility class
    }

    /**
     * @return every registered backend provider
     */
    public static List<GenerationCollaboratorProvider> providers() {
        List<GenerationCollaboratorProvider> providers = new ArrayList<>();
        ServiceLoader.load(GenerationCollaboratorProvider.class).forEach(providers::add);
        return providers;
    }

    /**
     * Creates the collaborator selected by {@code generation.backend}.
     *
     * @param settings generation settings
     * @param projectDir target project directory
     * @return configured collaborator
     * @throws IllegalArgumentException if no provider has the configured id
     */
    public static GenerationCollaborator create(GenerationSettings settings, Path projectDir) {
        List<GenerationCollaboratorProvider> providers = providers();
        for (GenerationCollaboratorProvider provider : providers) {
            if (provider.getId().equals(settings.backend())) {
                log.info("Using generation backend: {} ({})", provider.getDisplayName(), provider.getId());
                return provider.create(settings, projectDir);
            }
        }
        List<String> available = providers.stream().map(GenerationCollaboratorProvider::getId).toList();
        throw new IllegalArgumentException(
            "Unknown generation backend '" + settings.backend() + "'. Available: " + available);
    }
}
