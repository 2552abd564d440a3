package com.vtb.attacktree.errors;

import lombok.Getter;

/**
 * Вычисление дошло до листа без обязательного числового поля
 */
@Getter
public class MissingValueException extends AttackTreeException {

    private final String nodeId;
    private final String field;

    public MissingValueException(String nodeId, String field) {
        super(String.format("У листа '%s' не задано поле %s", nodeId, field));
        this.nodeId = nodeId;
        this.field = field;
    }
}
