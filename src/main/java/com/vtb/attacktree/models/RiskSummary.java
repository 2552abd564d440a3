package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итоги анализа дерева для отображения.
 *
 * При {@code available == false} вероятность и ущерб не вычислены
 * (например, у листьев ещё не заполнены значения), причина в {@code unavailableReason}.
 */
@Data
@Builder
public class RiskSummary {
    private String rootId;
    private String rootLabel;
    private int nodeCount;
    @Builder.Default
    private List<AttackNode> leaves = new ArrayList<>();
    @Builder.Default
    private boolean available = false;
    private Double topEventProbability;
    private Double expectedLoss;
    @Builder.Default
    private List<Contributor> topContributors = new ArrayList<>();
    private String unavailableReason;
}
