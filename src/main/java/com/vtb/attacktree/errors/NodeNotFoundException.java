package com.vtb.attacktree.errors;

import lombok.Getter;

/**
 * Узел для анализа чувствительности отсутствует или не является листом
 */
@Getter
public class NodeNotFoundException extends AttackTreeException {

    private final String nodeId;

    public NodeNotFoundException(String nodeId, String message) {
        super(message);
        this.nodeId = nodeId;
    }
}
