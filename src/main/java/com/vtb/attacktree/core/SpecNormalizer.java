package com.vtb.attacktree.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attacktree.errors.SpecException;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.NodeKind;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Построение внутреннего графа узлов из обобщённого дерева значений.
 *
 * Корень описан полями верхнего уровня ({@code id}, {@code label}, {@code type},
 * {@code children}), остальные узлы перечислены в {@code nodes}. Повторные объявления
 * одного id сливаются, если типы совпадают. После слияния проверяется, что все
 * ссылки на детей указывают на объявленные узлы. При любой ошибке бросается
 * {@link SpecException}, частично построенное дерево наружу не отдаётся.
 */
@Slf4j
public class SpecNormalizer {

    private static final String FIELD_ID = "id";
    private static final String FIELD_LABEL = "label";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_CHILDREN = "children";
    private static final String FIELD_NODES = "nodes";
    private static final String FIELD_PROB = "prob";
    private static final String FIELD_IMPACT = "impact";

    public AttackTree normalize(JsonNode spec) {
        if (spec == null || !spec.isObject()) {
            throw new SpecException("Спецификация должна быть отображением на верхнем уровне");
        }
        String rootId = scalarText(spec, FIELD_ID, "<root>");
        if (rootId == null || rootId.isBlank()) {
            throw new SpecException("Отсутствует id корневого узла");
        }
        rootId = rootId.trim();

        Map<String, AttackNode> nodes = new LinkedHashMap<>();
        nodes.put(rootId, normalizeNode(rootId, spec));

        for (JsonNode raw : asSequence(spec.get(FIELD_NODES), FIELD_NODES, rootId)) {
            if (raw == null || !raw.isObject()) {
                throw new SpecException("Каждый элемент nodes должен быть отображением");
            }
            String id = scalarText(raw, FIELD_ID, "<node>");
            if (id == null || id.isBlank()) {
                throw new SpecException("Каждый узел в nodes должен иметь id");
            }
            merge(nodes, normalizeNode(id.trim(), raw));
        }

        validateChildren(nodes);

        log.debug("Спецификация нормализована: корень '{}', узлов {}", rootId, nodes.size());
        return new AttackTree(rootId, nodes);
    }

    /**
     * Значения по умолчанию в зависимости от типа: у листа нет детей,
     * у внутреннего узла нет вероятности и ущерба
     */
    private AttackNode normalizeNode(String id, JsonNode raw) {
        String type = scalarText(raw, FIELD_TYPE, id);
        String normalizedType = type == null ? "" : type.trim().toUpperCase(Locale.ROOT);

        AttackNode.AttackNodeBuilder builder = AttackNode.builder()
            .id(id)
            .label(scalarText(raw, FIELD_LABEL, id))
            .type(normalizedType);

        if (NodeKind.parse(normalizedType) == NodeKind.LEAF) {
            builder.children(new ArrayList<>());
            builder.probability(probability(id, raw))
                .impact(impact(id, raw));
        } else {
            builder.children(childIds(id, raw.get(FIELD_CHILDREN)));
        }
        return builder.build();
    }

    private List<String> childIds(String parentId, JsonNode rawChildren) {
        List<String> ids = new ArrayList<>();
        for (JsonNode child : asSequence(rawChildren, FIELD_CHILDREN, parentId)) {
            String childId;
            if (child == null || child.isNull()) {
                throw new SpecException("Узел '" + parentId + "' содержит пустую ссылку на дочерний узел");
            } else if (child.isObject()) {
                childId = scalarText(child, FIELD_ID, parentId);
            } else if (child.isValueNode()) {
                childId = child.asText();
            } else {
                throw new SpecException("Узел '" + parentId + "': элемент children должен быть id или отображением");
            }
            if (childId == null || childId.isBlank()) {
                throw new SpecException("Узел '" + parentId + "' содержит дочерний узел без id");
            }
            ids.add(childId.trim());
        }
        return ids;
    }

    private void merge(Map<String, AttackNode> nodes, AttackNode node) {
        AttackNode existing = nodes.get(node.getId());
        if (existing == null) {
            nodes.put(node.getId(), node);
            return;
        }
        if (!existing.getType().equals(node.getType())) {
            throw new SpecException(String.format(
                "Дубликат узла '%s' с конфликтующими типами: %s и %s",
                node.getId(), existing.getType(), node.getType()));
        }
        log.debug("Слияние повторного объявления узла '{}'", node.getId());
        if (node.getProbability() != null) {
            existing.setProbability(node.getProbability());
        }
        if (node.getImpact() != null) {
            existing.setImpact(node.getImpact());
        }
        if (!node.getChildren().isEmpty()) {
            existing.setChildren(node.getChildren());
        }
        if (existing.getLabel() == null && node.getLabel() != null) {
            existing.setLabel(node.getLabel());
        }
    }

    private void validateChildren(Map<String, AttackNode> nodes) {
        for (AttackNode node : nodes.values()) {
            if (node.isLeaf()) {
                continue;
            }
            for (String childId : node.getChildren()) {
                if (!nodes.containsKey(childId)) {
                    throw new SpecException(String.format(
                        "Узел '%s' ссылается на неизвестный дочерний узел '%s'", node.getId(), childId));
                }
            }
        }
    }

    private Double probability(String id, JsonNode raw) {
        Double value = number(id, raw, FIELD_PROB);
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            throw new SpecException(String.format(
                "Вероятность листа '%s' должна быть в диапазоне [0, 1], получено %s", id, value));
        }
        return value;
    }

    private Double impact(String id, JsonNode raw) {
        Double value = number(id, raw, FIELD_IMPACT);
        if (value != null && (value.isNaN() || value.isInfinite() || value < 0.0)) {
            throw new SpecException(String.format(
                "Ущерб листа '%s' должен быть неотрицательным числом, получено %s", id, value));
        }
        return value;
    }

    private Double number(String id, JsonNode raw, String field) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (text.isEmpty()) {
                return null;
            }
            try {
                return Double.parseDouble(text);
            } catch (NumberFormatException e) {
                throw new SpecException(String.format(
                    "Поле %s узла '%s' не является числом: '%s'", field, id, text));
            }
        }
        throw new SpecException(String.format("Поле %s узла '%s' не является числом", field, id));
    }

    private String scalarText(JsonNode raw, String field, String owner) {
        JsonNode value = raw.get(field);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (!value.isValueNode()) {
            throw new SpecException(String.format("Поле %s узла '%s' должно быть скаляром", field, owner));
        }
        return value.asText();
    }

    /**
     * Отсутствующее значение - пустая последовательность, одиночное отображение -
     * последовательность из одного элемента
     */
    private Iterable<JsonNode> asSequence(JsonNode value, String field, String owner) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Collections.emptyList();
        }
        if (value.isArray()) {
            return value;
        }
        if (value.isObject() || (FIELD_CHILDREN.equals(field) && value.isValueNode())) {
            return List.of(value);
        }
        throw new SpecException(String.format("Поле %s узла '%s' должно быть последовательностью", field, owner));
    }
}
