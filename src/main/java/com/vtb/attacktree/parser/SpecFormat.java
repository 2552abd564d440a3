package com.vtb.attacktree.parser;

import com.vtb.attacktree.errors.FormatException;

import java.util.List;
import java.util.Locale;

/**
 * Поддерживаемые текстовые форматы спецификаций
 */
public enum SpecFormat {
    YAML(List.of("yaml", "yml")),
    JSON(List.of("json")),
    XML(List.of("xml"));

    private final List<String> tags;

    SpecFormat(List<String> tags) {
        this.tags = tags;
    }

    public List<String> getTags() {
        return tags;
    }

    /**
     * Формат по тегу ("yaml", ".yml", "JSON"...)
     *
     * @throws FormatException если тег не поддерживается
     */
    public static SpecFormat fromTag(String tag) {
        String normalized = tag == null ? "" : tag.trim().toLowerCase(Locale.ROOT);
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        for (SpecFormat format : values()) {
            if (format.tags.contains(normalized)) {
                return format;
            }
        }
        throw new FormatException("Неподдерживаемый формат '" + tag + "'");
    }

    /**
     * Формат по расширению имени файла
     */
    public static SpecFormat fromFileName(String fileName) {
        if (fileName == null) {
            throw new FormatException("Неподдерживаемый формат 'null'");
        }
        int dot = fileName.lastIndexOf('.');
        String extension = dot >= 0 ? fileName.substring(dot + 1) : "";
        return fromTag(extension);
    }
}
