package com.portkit.core.facts;

import com.portkit.core.graph.MalformedGraphException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link FactsLoader}.
 */
class FactsLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_json_returnsDocument() throws IOException {
        Path facts = tempDir.resolve("facts.json");
        Files.writeString(facts, """
            {
              "external": ["size_t"],
              "symbols": [
                {"name": "Node", "kind": "struct", "file": "list.h", "line": 4, "dependencies": ["size_t"]},
                {"name": "push", "kind": "function", "static": true, "dependencies": ["Node"],
                 "definition": "void push(Node *n) {}", "unknownField": 1}
              ]
            }
            """);

        FactsDocument document = FactsLoader.load(facts);

        assertThat(document.external()).containsExactly("size_t");
        assertThat(document.symbols()).hasSize(2);
        SymbolFact push = document.symbols().get(1);
        assertThat(push.name()).isEqualTo("push");
        assertThat(push.isStatic()).isTrue();
        assertThat(push.dependencies()).containsExactly("Node");
        assertThat(push.definition()).startsWith("void push");
        assertThat(document.symbols().get(0).line()).isEqualTo(4);
    }

    @Test
    void load_yaml_returnsDocument() throws IOException {
        Path facts = tempDir.resolve("facts.yaml");
        Files.writeString(facts, """
            symbols:
              - name: MAX_LEN
                kind: macro_constant
              - name: clamp
                kind: function
                is_cycle: true
                dependencies: [MAX_LEN]
            """);

        FactsDocument document = FactsLoader.load(facts);

        assertThat(document.external()).isEmpty();
        assertThat(document.symbols()).extracting(SymbolFact::name).containsExactly("MAX_LEN", "clamp");
        assertThat(document.symbols().get(1).isCycle()).isTrue();
    }

    @Test
    void load_missingFile_throwsMalformedGraph() {
        assertThatThrownBy(() -> FactsLoader.load(tempDir.resolve("absent.json")))
            .isInstanceOf(MalformedGraphException.class)
            .hasMessageContaining("Facts file not found");
    }

    @Test
    void load_invalidJson_throwsMalformedGraph() throws IOException {
        Path facts = tempDir.resolve("facts.json");
        Files.writeString(facts, "{ \"symbols\": [ {");

        assertThatThrownBy(() -> FactsLoader.load(facts))
            .isInstanceOf(MalformedGraphException.class)
            .hasMessageContaining("Failed to parse facts file");
    }
}
