package com.vtb.attacktree.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Экспорт дерева обратно в YAML (формат A).
 *
 * Корень пишется на верхнем уровне вместе с {@code children}, остальные узлы в
 * {@code nodes} в порядке объявления. Листья несут {@code prob}/{@code impact}
 * (возможно null), внутренние узлы несут {@code children}.
 * Все строки пишутся в кавычках: иначе id и метки вида {@code 1e3} или {@code .inf}
 * при повторном чтении станут числами.
 */
@Slf4j
public class YamlSpecExporter {

    private final ObjectMapper mapper;

    public YamlSpecExporter() {
        YAMLFactory factory = YAMLFactory.builder()
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();
        this.mapper = new ObjectMapper(factory);
    }

    public String export(AttackTree tree) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        try {
            return mapper.writeValueAsString(toDocument(tree));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Ошибка сериализации дерева в YAML", e);
        }
    }

    public void export(AttackTree tree, Path outputPath) throws IOException {
        String yaml = export(tree);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, yaml);
        log.info("Спецификация сохранена: {} ({} узлов)", outputPath, tree.size());
    }

    Map<String, Object> toDocument(AttackTree tree) {
        AttackNode root = tree.getRoot();
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("id", tree.getRootId());
        document.put("label", root.getLabel());
        document.put("type", typeOf(root));
        document.put("children", new ArrayList<>(root.getChildren()));
        if (root.isLeaf()) {
            document.put("prob", root.getProbability());
            document.put("impact", root.getImpact());
        }

        List<Map<String, Object>> entries = new ArrayList<>();
        for (AttackNode node : tree.getNodes().values()) {
            if (node.getId().equals(tree.getRootId())) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", node.getId());
            entry.put("label", node.getLabel());
            entry.put("type", typeOf(node));
            if (node.isLeaf()) {
                entry.put("prob", node.getProbability());
                entry.put("impact", node.getImpact());
            } else {
                entry.put("children", new ArrayList<>(node.getChildren()));
            }
            entries.add(entry);
        }
        document.put("nodes", entries);
        return document;
    }

    private String typeOf(AttackNode node) {
        return node.getType() == null || node.getType().isEmpty() ? null : node.getType();
    }
}
