package com.vtb.attacktree.errors;

import lombok.Getter;

/**
 * Цикл в графе узлов или превышение допустимой глубины рекурсии
 */
@Getter
public class CycleException extends AttackTreeException {

    private final String nodeId;

    public CycleException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }
}
