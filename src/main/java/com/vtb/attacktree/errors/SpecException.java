package com.vtb.attacktree.errors;

/**
 * Структурная ошибка спецификации: нет id, ссылка на несуществующий
 * дочерний узел, конфликт типов у дубликатов
 */
public class SpecException extends AttackTreeException {

    public SpecException(String message) {
        super(message);
    }
}
