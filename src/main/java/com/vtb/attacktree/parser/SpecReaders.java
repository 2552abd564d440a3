package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Выбор читателя по формату
 */
public final class SpecReaders {

    private SpecReaders() {}

    public static SpecReader forFormat(SpecFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Формат не может быть null");
        }
        return switch (format) {
            case YAML -> new YamlSpecReader();
            case JSON -> new JsonSpecReader();
            case XML -> new XmlSpecReader();
        };
    }

    /**
     * Разобрать текст в формате, заданном тегом
     *
     * @throws com.vtb.attacktree.errors.FormatException для неизвестного тега или некорректного синтаксиса
     */
    public static JsonNode read(String text, String formatTag) {
        return forFormat(SpecFormat.fromTag(formatTag)).read(text);
    }
}
