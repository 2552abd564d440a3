package com.vtb.attacktree.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Узел дерева атак.
 *
 * {@code type} хранится в верхнем регистре так, как он объявлен во входном документе;
 * тип вне {@link NodeKind} сохраняется и обнаруживается при вычислении.
 */
@Data
@Builder(toBuilder = true)
public class AttackNode {
    private String id;
    private String label;
    @Builder.Default
    private String type = "";
    @Builder.Default
    private List<String> children = new ArrayList<>();
    private Double probability;
    private Double impact;

    @JsonIgnore
    public NodeKind getKind() {
        return NodeKind.parse(type);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return getKind() == NodeKind.LEAF;
    }

    /**
     * Глубокая копия: список детей не разделяется с оригиналом
     */
    public AttackNode copy() {
        return toBuilder()
            .children(new ArrayList<>(children != null ? children : List.of()))
            .build();
    }
}
