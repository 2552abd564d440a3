package com.vtb.attacktree.parser;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Декодер одного текстового формата в обобщённое дерево значений.
 *
 * Семантически одинаковые документы в любом формате дают одинаковый результат:
 * отображения становятся {@code ObjectNode}, последовательности {@code ArrayNode}.
 * Из структуры дерева атак читателю известна только форма полей
 * {@code children} и {@code nodes}.
 */
public interface SpecReader {

    /**
     * Разобрать текст документа
     *
     * @param text содержимое документа
     * @return обобщённое дерево значений
     * @throws com.vtb.attacktree.errors.FormatException если синтаксис некорректен
     */
    JsonNode read(String text);

    SpecFormat getFormat();
}
