package com.vtb.attacktree.models;

import com.vtb.attacktree.errors.NodeNotFoundException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Нормализованная спецификация дерева атак: id корня и узлы в порядке объявления.
 *
 * После построения изменяются только вероятность и ущерб листьев;
 * структура дерева остаётся неизменной.
 * Экземпляр не потокобезопасен.
 */
public class AttackTree {

    private final String rootId;
    private final Map<String, AttackNode> nodes;

    public AttackTree(String rootId, Map<String, AttackNode> nodes) {
        this.rootId = Objects.requireNonNull(rootId, "rootId");
        this.nodes = new LinkedHashMap<>(Objects.requireNonNull(nodes, "nodes"));
        if (!this.nodes.containsKey(rootId)) {
            throw new IllegalArgumentException("Корень '" + rootId + "' отсутствует среди узлов дерева");
        }
    }

    public String getRootId() {
        return rootId;
    }

    public AttackNode getRoot() {
        return nodes.get(rootId);
    }

    /**
     * Узлы в порядке объявления (только чтение)
     */
    public Map<String, AttackNode> getNodes() {
        return Collections.unmodifiableMap(nodes);
    }

    public AttackNode getNode(String id) {
        return nodes.get(id);
    }

    public int size() {
        return nodes.size();
    }

    public List<AttackNode> getLeaves() {
        List<AttackNode> leaves = new ArrayList<>();
        for (AttackNode node : nodes.values()) {
            if (node.isLeaf()) {
                leaves.add(node);
            }
        }
        return leaves;
    }

    /**
     * Найти лист по id
     *
     * @throws NodeNotFoundException если узла нет или он не лист
     */
    public AttackNode requireLeaf(String leafId) {
        AttackNode node = leafId != null ? nodes.get(leafId) : null;
        if (node == null) {
            throw new NodeNotFoundException(leafId, "Узел '" + leafId + "' не найден");
        }
        if (!node.isLeaf()) {
            throw new NodeNotFoundException(leafId, "Узел '" + leafId + "' не является листом");
        }
        return node;
    }

    /**
     * Глубокая копия карты узлов
     */
    public AttackTree copy() {
        Map<String, AttackNode> copied = new LinkedHashMap<>();
        nodes.forEach((id, node) -> copied.put(id, node.copy()));
        return new AttackTree(rootId, copied);
    }

    @Override
    public String toString() {
        return "AttackTree{root=" + rootId + ", nodes=" + nodes.size() + "}";
    }
}
