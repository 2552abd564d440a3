package com.vtb.attacktree.models;

import java.util.Locale;

/**
 * Типы узлов дерева атак
 */
public enum NodeKind {
    AND,
    OR,
    LEAF;

    /**
     * Тип узла по строке без учёта регистра; {@code null}, если тип вне закрытого набора
     */
    public static NodeKind parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (NodeKind kind : values()) {
            if (kind.name().equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
