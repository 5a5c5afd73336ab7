package com.portkit.cli;

import com.portkit.core.config.ConfigLoader;
import com.portkit.core.config.PortkitConfig;
import com.portkit.core.config.ProjectLayout;
import com.portkit.core.facts.FactsDocument;
import com.portkit.core.facts.FactsLoader;
import com.portkit.core.graph.SymbolGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration and resolved paths shared by the commands.
 *
 * @param config loaded configuration
 * @param layout resolved paths
 */
record ProjectContext(PortkitConfig config, ProjectLayout layout) {

    private static final Logger log = LoggerFactory.getLogger(ProjectContext.class);

    /**
     * Loads configuration; relative paths resolve against the configuration file's directory.
     */
    static ProjectContext load(Path configPath) {
        Path absoluteConfigPath = configPath.toAbsolutePath().normalize();
        PortkitConfig config = ConfigLoader.load(absoluteConfigPath);
        ProjectLayout layout = ProjectLayout.of(config, absoluteConfigPath.getParent());
        log.debug("Project layout: {}", layout);
        return new ProjectContext(config, layout);
    }

    /**
     * Loads the facts document and builds the symbol graph. External names from
     * the document and from configuration are merged.
     */
    SymbolGraph buildGraph() {
        FactsDocument facts = FactsLoader.load(layout.factsPath());
        Set<String> external = new LinkedHashSet<>(facts.external());
        external.addAll(config.facts().external());
        return SymbolGraph.build(facts.symbols(), external);
    }
}
