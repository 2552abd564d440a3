package com.vtb.attacktree.reports;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.AttackTreeLoader;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для YamlSpecExporter
 */
class YamlSpecExporterTest {

    private final AttackTreeLoader loader = new AttackTreeLoader(AnalyzerConfig.defaults());
    private final YamlSpecExporter exporter = new YamlSpecExporter();

    @Test
    void testExportedSpecParsesBackToSameTree() {
        AttackTree original = loader.parse("""
            id: root
            label: Top
            type: OR
            children: [gate, x, numeric]
            nodes:
              - {id: gate, label: Gate, type: AND, children: [y, "007"]}
              - {id: x, label: X, type: LEAF, prob: 0.1, impact: 100}
              - {id: y, label: Y, type: LEAF, prob: 0.35}
              - {id: "007", label: "true", type: LEAF}
              - {id: numeric, label: "1e3", type: OR, children: ["1_000", "0x1F", ".inf", "1.0e+3"]}
              - {id: "1_000", label: "0b11", type: LEAF, prob: 0.2, impact: 1}
              - {id: "0x1F", label: "~", type: LEAF}
              - {id: ".inf", label: "-.Inf", type: LEAF}
              - {id: "1.0e+3", label: ".NaN", type: LEAF}
            """, "yaml");

        String yaml = exporter.export(original);
        AttackTree reparsed = loader.parse(yaml, "yaml");

        assertEquals(original.getRootId(), reparsed.getRootId());
        assertEquals(original.getNodes().keySet(), reparsed.getNodes().keySet());
        for (AttackNode node : original.getNodes().values()) {
            AttackNode copy = reparsed.getNode(node.getId());
            assertEquals(node.getLabel(), copy.getLabel(), node.getId());
            assertEquals(node.getType(), copy.getType(), node.getId());
            assertEquals(node.getChildren(), copy.getChildren(), node.getId());
            assertEquals(node.getProbability(), copy.getProbability(), node.getId());
            assertEquals(node.getImpact(), copy.getImpact(), node.getId());
        }
    }

    @Test
    void testRootIsInlineAndLeavesCarryValues() {
        AttackTree tree = loader.parse("""
            {"id": "r", "type": "AND", "children": ["a"],
             "nodes": [{"id": "a", "type": "LEAF", "prob": 0.5}]}
            """, "json");

        String yaml = exporter.export(tree);

        assertTrue(yaml.startsWith("id: \"r\""), yaml);
        assertTrue(yaml.contains("prob: 0.5"), yaml);
        assertTrue(yaml.contains("impact: null"), yaml);
        assertFalse(yaml.contains("- id: \"r\""), "Корень не повторяется в nodes");
    }

    @Test
    void testExportToFile(@TempDir Path dir) throws IOException {
        AttackTree tree = loader.loadDemo("pre");
        Path target = dir.resolve("out/updated_spec.yaml");

        exporter.export(tree, target);

        assertTrue(Files.exists(target));
        AttackTree reparsed = loader.loadFromFile(target);
        assertEquals(tree.getNodes().keySet(), reparsed.getNodes().keySet());
    }
}
