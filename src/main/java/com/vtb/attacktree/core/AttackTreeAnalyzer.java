package com.vtb.attacktree.core;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.edit.EditOutcome;
import com.vtb.attacktree.edit.LeafEdit;
import com.vtb.attacktree.edit.LeafEditor;
import com.vtb.attacktree.errors.CycleException;
import com.vtb.attacktree.errors.InvalidNodeException;
import com.vtb.attacktree.errors.MissingValueException;
import com.vtb.attacktree.errors.SpecException;
import com.vtb.attacktree.evaluation.RiskEvaluator;
import com.vtb.attacktree.evaluation.SensitivityAnalyzer;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.Contributor;
import com.vtb.attacktree.models.RiskSummary;
import com.vtb.attacktree.models.SensitivityResult;
import com.vtb.attacktree.reports.YamlSpecExporter;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Главный фасад анализа дерева атак.
 *
 * Дерево передаётся явно в каждый вызов и принадлежит вызывающему;
 * фасад не хранит "текущую" спецификацию.
 */
@Slf4j
public class AttackTreeAnalyzer {

    private final AnalyzerConfig config;
    private final AttackTreeLoader loader;
    private final SensitivityAnalyzer sensitivityAnalyzer;
    private final LeafEditor leafEditor = new LeafEditor();
    private final YamlSpecExporter exporter = new YamlSpecExporter();

    public AttackTreeAnalyzer() {
        this(AnalyzerConfig.load());
    }

    public AttackTreeAnalyzer(AnalyzerConfig config) {
        this.config = config;
        this.loader = new AttackTreeLoader(config);
        this.sensitivityAnalyzer = new SensitivityAnalyzer(config.getEvaluation().getMaxDepth());
    }

    public AttackTreeLoader getLoader() {
        return loader;
    }

    public RiskSummary summarize(AttackTree tree) {
        return summarize(tree, config.getEvaluation().getTopContributors());
    }

    /**
     * Итоги для отображения. Если вычислить результаты нельзя (не заполнены значения,
     * неизвестный тип, цикл), возвращается сводка с {@code available = false} и причиной.
     */
    public RiskSummary summarize(AttackTree tree, int topN) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        List<AttackNode> leaves = tree.getLeaves().stream()
            .sorted(Comparator.comparing(AttackNode::getId))
            .collect(Collectors.toList());

        RiskSummary.RiskSummaryBuilder summary = RiskSummary.builder()
            .rootId(tree.getRootId())
            .rootLabel(tree.getRoot().getLabel())
            .nodeCount(tree.size())
            .leaves(leaves);

        try {
            double probability = RiskEvaluator.topEventProbability(tree, config.getEvaluation().getMaxDepth());
            double loss = RiskEvaluator.expectedLoss(tree);
            List<Contributor> top = RiskEvaluator.topContributors(tree, topN);
            log.info("Дерево '{}': P(top) = {}, ожидаемый ущерб = {}", tree.getRootId(), probability, loss);
            return summary.available(true)
                .topEventProbability(probability)
                .expectedLoss(loss)
                .topContributors(top)
                .build();
        } catch (MissingValueException | InvalidNodeException | CycleException | SpecException e) {
            log.warn("Результаты для дерева '{}' недоступны: {}", tree.getRootId(), e.getMessage());
            return summary.available(false)
                .unavailableReason(e.getMessage())
                .build();
        }
    }

    public SensitivityResult previewSensitivity(AttackTree tree, String leafId, double multiplier) {
        return sensitivityAnalyzer.preview(tree, leafId, multiplier);
    }

    public AttackTree commitSensitivity(AttackTree tree, String leafId, double multiplier) {
        return sensitivityAnalyzer.commit(tree, leafId, multiplier);
    }

    public AttackTree commitSensitivity(AttackTree tree, SensitivityResult run) {
        return sensitivityAnalyzer.commit(tree, run);
    }

    public EditOutcome applyEdits(AttackTree tree, List<LeafEdit> edits) {
        return leafEditor.apply(tree, edits);
    }

    public EditOutcome applyForm(AttackTree tree, Map<String, String> form) {
        return leafEditor.applyForm(tree, form);
    }

    public String exportYaml(AttackTree tree) {
        return exporter.export(tree);
    }
}
