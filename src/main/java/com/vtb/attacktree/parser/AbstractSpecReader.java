package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.vtb.attacktree.errors.FormatException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;

/**
 * Общая часть читателей: обёртка ошибок синтаксиса и приведение
 * одноэлементных коллекций к последовательностям
 */
@Slf4j
public abstract class AbstractSpecReader implements SpecReader {

    static final String CHILDREN = "children";
    static final String NODES = "nodes";

    private static final char BOM = '\uFEFF';

    @Override
    public JsonNode read(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Текст спецификации не может быть null");
        }
        String content = !text.isEmpty() && text.charAt(0) == BOM ? text.substring(1) : text;

        JsonNode tree;
        try {
            tree = parseTree(content);
        } catch (IOException | RuntimeException e) {
            log.debug("Ошибка разбора {}: {}", getFormat(), e.getMessage());
            throw new FormatException(
                String.format("Не удалось разобрать %s: %s", getFormat(), e.getMessage()), e);
        }
        if (tree == null) {
            return MissingNode.getInstance();
        }
        return normalizeSequences(tree);
    }

    /**
     * Разбор синтаксиса конкретного формата
     */
    protected abstract JsonNode parseTree(String content) throws IOException;

    /**
     * Одиночный скаляр или отображение в {@code children} и одиночное отображение
     * в {@code nodes} превращаются в последовательность из одного элемента
     */
    static JsonNode normalizeSequences(JsonNode tree) {
        if (!tree.isObject()) {
            return tree;
        }
        ObjectNode root = (ObjectNode) tree;
        normalizeChildren(root);

        JsonNode nodes = root.get(NODES);
        if (nodes != null && nodes.isObject()) {
            root.set(NODES, singleton(nodes));
            nodes = root.get(NODES);
        }
        if (nodes != null && nodes.isArray()) {
            for (JsonNode entry : nodes) {
                if (entry.isObject()) {
                    normalizeChildren((ObjectNode) entry);
                }
            }
        }
        return root;
    }

    private static void normalizeChildren(ObjectNode node) {
        JsonNode children = node.get(CHILDREN);
        if (children == null || children.isArray()) {
            return;
        }
        if (children.isNull()) {
            node.set(CHILDREN, JsonNodeFactory.instance.arrayNode());
        } else {
            node.set(CHILDREN, singleton(children));
        }
    }

    static ArrayNode singleton(JsonNode element) {
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        array.add(element);
        return array;
    }
}
