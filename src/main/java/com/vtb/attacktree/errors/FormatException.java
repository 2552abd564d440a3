package com.vtb.attacktree.errors;

/**
 * Документ не удалось разобрать, либо формат не поддерживается
 */
public class FormatException extends AttackTreeException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
