package com.vtb.attacktree.errors;

/**
 * Базовое исключение анализатора деревьев атак
 */
public class AttackTreeException extends RuntimeException {

    public AttackTreeException(String message) {
        super(message);
    }

    public AttackTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
