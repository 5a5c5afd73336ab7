package com.portkit.core.facts;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.portkit.core.graph.MalformedGraphException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Loads a {@link FactsDocument} from JSON or YAML.
 *
 * <p>The format is chosen by file extension: {@code .yaml} and {@code .yml} are
 * read as YAML, anything else as JSON. Unlike configuration, facts have no
 * sensible default, so every problem is reported as a {@link MalformedGraphException}.
 */
public final class FactsLoader {

    private static final Logger log = LoggerFactory.getLogger(FactsLoader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private FactsLoader() {
        // Utility class
    }

    /**
     * Reads and parses a facts document.
     *
     * @param factsPath path to the analyzer output
     * @return parsed document
     * @throws MalformedGraphException if the file is missing, unreadable or not a facts document
     */
    public static FactsDocument load(Path factsPath) {
        if (!Files.isRegularFile(factsPath)) {
            throw new MalformedGraphException(List.of("Facts file not found: " + factsPath));
        }

        ObjectMapper mapper = isYaml(factsPath) ? YAML_MAPPER : JSON_MAPPER;
        try {
            log.debug("Loading symbol facts from: {}", factsPath);
            FactsDocument document = mapper.readValue(factsPath.toFile(), FactsDocument.class);
            if (document == null) {
                throw new MalformedGraphException(List.of("Facts file is empty: " + factsPath));
            }
            log.info("Loaded {} symbol facts ({} external names) from: {}",
                document.symbols().size(), document.external().size(), factsPath);
            return document;
        } catch (IOException e) {
            throw new MalformedGraphException(
                List.of("Failed to parse facts file " + factsPath + ": " + e.getMessage()), e);
        }
    }

    private static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yaml") || fileName.endsWith(".yml");
    }
}
