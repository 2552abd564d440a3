package com.vtb.attacktree.errors;

import lombok.Getter;

@Getter
public class InvalidNodeException extends AttackTreeException {

    private final String nodeId;

    public InvalidNodeException(String nodeId, String type) {
        super(String.format("Неизвестный тип узла '%s' у узла '%s'", type, nodeId));
        this.nodeId = nodeId;
    }
}
