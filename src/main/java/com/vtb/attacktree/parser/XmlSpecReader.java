package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Формат C: XML.
 *
 * Имя корневого элемента не важно. Обёртки вида
 * {@code <children><child>a</child></children>} и {@code <nodes><node>...</node></nodes>}
 * разворачиваются в последовательности независимо от числа элементов внутри.
 * Все значения в XML текстовые, приведение типов делает нормализатор.
 */
public class XmlSpecReader extends AbstractSpecReader {

    private static final Set<String> SEQUENCE_FIELDS = Set.of(CHILDREN, NODES);

    private final XmlMapper mapper = new XmlMapper();

    @Override
    protected JsonNode parseTree(String content) throws IOException {
        JsonNode tree = mapper.readTree(content);
        return tree == null ? null : unwrap(tree);
    }

    @Override
    public SpecFormat getFormat() {
        return SpecFormat.XML;
    }

    private JsonNode unwrap(JsonNode value) {
        if (value.isObject()) {
            ObjectNode object = (ObjectNode) value;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                JsonNode field = object.get(name);
                object.set(name, SEQUENCE_FIELDS.contains(name) ? unwrapSequence(field) : unwrap(field));
            }
            return object;
        }
        if (value.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            value.forEach(element -> array.add(unwrap(element)));
            return array;
        }
        if (value.isTextual()) {
            return TextNode.valueOf(value.asText().trim());
        }
        return value;
    }

    private JsonNode unwrapSequence(JsonNode value) {
        ArrayNode result = JsonNodeFactory.instance.arrayNode();
        if (value == null || value.isNull()) {
            return result;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            if (!text.isEmpty()) {
                result.add(text);
            }
            return result;
        }
        if (value.isArray()) {
            value.forEach(element -> result.add(unwrap(element)));
            return result;
        }
        if (value.isObject()) {
            // <children><child>a</child></children>: единственное поле-обёртка
            if (value.size() == 1 && !value.has("id")) {
                JsonNode inner = value.elements().next();
                if (inner.isArray()) {
                    inner.forEach(element -> result.add(unwrap(element)));
                } else {
                    result.add(unwrap(inner));
                }
                return result;
            }
            if (value.size() > 0) {
                result.add(unwrap(value));
            }
            return result;
        }
        result.add(value);
        return result;
    }
}
