package com.vtb.attacktree.evaluation;

import com.vtb.attacktree.errors.MissingValueException;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.SensitivityResult;
import lombok.extern.slf4j.Slf4j;

/**
 * Анализ чувствительности: вероятность одного листа умножается на коэффициент,
 * после чего пересчитываются вероятность верхнего события и ожидаемый ущерб.
 *
 * Новая вероятность ограничивается диапазоном [0, 1] с обеих сторон,
 * так что отрицательный коэффициент даёт 0, а не отрицательную вероятность.
 */
@Slf4j
public class SensitivityAnalyzer {

    private final int maxDepth;

    public SensitivityAnalyzer() {
        this(RiskEvaluator.DEFAULT_MAX_DEPTH);
    }

    public SensitivityAnalyzer(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    /**
     * Предварительный расчёт на копии дерева; исходное дерево не меняется
     */
    public SensitivityResult preview(AttackTree tree, String leafId, double multiplier) {
        double base = baseProbability(tree, leafId);
        double adjusted = adjust(base, multiplier);

        AttackTree copy = tree.copy();
        copy.getNode(leafId).setProbability(adjusted);

        double topEvent = RiskEvaluator.topEventProbability(copy, maxDepth);
        double loss = RiskEvaluator.expectedLoss(copy);
        log.info("Чувствительность '{}' x{}: p {} -> {}, P(top) = {}, ущерб = {}",
            leafId, multiplier, base, adjusted, topEvent, loss);

        return SensitivityResult.builder()
            .leafId(leafId)
            .multiplier(multiplier)
            .baseProbability(base)
            .adjustedProbability(adjusted)
            .topEventProbability(topEvent)
            .expectedLoss(loss)
            .build();
    }

    /**
     * Записать новую вероятность прямо в дерево вызывающего.
     * Ранее вычисленные по этому дереву результаты становятся устаревшими.
     */
    public AttackTree commit(AttackTree tree, String leafId, double multiplier) {
        double base = baseProbability(tree, leafId);
        double adjusted = adjust(base, multiplier);
        tree.getNode(leafId).setProbability(adjusted);
        log.info("Вероятность листа '{}' изменена: {} -> {} (x{})", leafId, base, adjusted, multiplier);
        return tree;
    }

    /**
     * Применить ранее рассчитанный прогон к текущим значениям дерева
     */
    public AttackTree commit(AttackTree tree, SensitivityResult run) {
        if (run == null) {
            throw new IllegalArgumentException("Нет прогона чувствительности для применения");
        }
        return commit(tree, run.getLeafId(), run.getMultiplier());
    }

    static double adjust(double base, double multiplier) {
        if (Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
            throw new IllegalArgumentException("Коэффициент должен быть конечным числом: " + multiplier);
        }
        return Math.max(0.0, Math.min(base * multiplier, 1.0));
    }

    private double baseProbability(AttackTree tree, String leafId) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        AttackNode leaf = tree.requireLeaf(leafId);
        if (leaf.getProbability() == null) {
            throw new MissingValueException(leafId, "prob");
        }
        return leaf.getProbability();
    }
}
