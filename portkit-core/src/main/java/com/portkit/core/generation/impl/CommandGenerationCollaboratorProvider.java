package com.portkit.core.generation.impl;

import com.portkit.core.config.PortkitConfig.GenerationSettings;
import com.portkit.core.generation.GenerationCollaborator;
import com.portkit.core.generation.GenerationCollaboratorProvider;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Provider for the {@code command} backend.
 */
public class CommandGenerationCollaboratorProvider implements GenerationCollaboratorProvider {

    @Override
    public String getId() {
        return "command";
    }

    @Override
    public String getDisplayName() {
        return "External Command (JSON over stdin/stdout)";
    }

    @Override
    public GenerationCollaborator create(GenerationSettings settings, Path projectDir) {
        return new CommandGenerationCollaborator(
            settings.command(), projectDir, Duration.ofSeconds(settings.timeoutSeconds()));
    }
}
