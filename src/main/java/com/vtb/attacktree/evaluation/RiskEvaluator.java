package com.vtb.attacktree.evaluation;

import com.vtb.attacktree.errors.CycleException;
import com.vtb.attacktree.errors.InvalidNodeException;
import com.vtb.attacktree.errors.MissingValueException;
import com.vtb.attacktree.errors.SpecException;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.Contributor;
import com.vtb.attacktree.models.NodeKind;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Вычисления над деревом атак: вероятность верхнего события, ожидаемый ущерб,
 * рейтинг вкладов листьев. Все методы чистые и не изменяют входные данные.
 *
 * Листья считаются независимыми событиями:
 * AND = произведение вероятностей детей, OR = 1 - произведение (1 - p).
 */
public final class RiskEvaluator {

    public static final int DEFAULT_MAX_DEPTH = 1_000;

    private RiskEvaluator() {}

    public static double topEventProbability(AttackTree tree) {
        return topEventProbability(tree.getRootId(), tree.getNodes(), DEFAULT_MAX_DEPTH);
    }

    public static double topEventProbability(AttackTree tree, int maxDepth) {
        return topEventProbability(tree.getRootId(), tree.getNodes(), maxDepth);
    }

    public static double topEventProbability(String rootId, Map<String, AttackNode> nodes) {
        return topEventProbability(rootId, nodes, DEFAULT_MAX_DEPTH);
    }

    /**
     * Вероятность события в узле {@code rootId} обходом в глубину
     *
     * @throws MissingValueException у листа не задана вероятность
     * @throws InvalidNodeException  тип узла вне AND/OR/LEAF
     * @throws CycleException        узел повторно встретился на текущем пути или превышена глубина
     * @throws SpecException         ссылка на отсутствующий узел
     */
    public static double topEventProbability(String rootId, Map<String, AttackNode> nodes, int maxDepth) {
        if (nodes == null) {
            throw new IllegalArgumentException("Карта узлов не может быть null");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth должен быть положительным: " + maxDepth);
        }
        return new ProbabilityWalk(nodes, maxDepth).probability(rootId, null, 0);
    }

    /**
     * Сумма вероятность × ущерб по всем листьям карты, независимо от достижимости из корня
     *
     * @throws MissingValueException для первого (в порядке карты) листа без вероятности или ущерба
     */
    public static double expectedLoss(Map<String, AttackNode> nodes) {
        double total = 0.0;
        for (AttackNode node : nodes.values()) {
            if (!node.isLeaf()) {
                continue;
            }
            if (node.getProbability() == null) {
                throw new MissingValueException(node.getId(), "prob");
            }
            if (node.getImpact() == null) {
                throw new MissingValueException(node.getId(), "impact");
            }
            total += node.getProbability() * node.getImpact();
        }
        return total;
    }

    public static double expectedLoss(AttackTree tree) {
        return expectedLoss(tree.getNodes());
    }

    /**
     * Первые {@code k} листьев по убыванию вероятность × ущерб.
     * Листья без одного из значений пропускаются; при равенстве сохраняется порядок карты.
     */
    public static List<Contributor> topContributors(Map<String, AttackNode> nodes, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("k не может быть отрицательным: " + k);
        }
        List<Contributor> contributions = new ArrayList<>();
        for (AttackNode node : nodes.values()) {
            if (!node.isLeaf() || node.getProbability() == null || node.getImpact() == null) {
                continue;
            }
            contributions.add(Contributor.builder()
                .id(node.getId())
                .label(node.getLabel())
                .value(node.getProbability() * node.getImpact())
                .build());
        }
        // List.sort стабильна
        contributions.sort(Comparator.comparingDouble(Contributor::getValue).reversed());
        return new ArrayList<>(contributions.subList(0, Math.min(k, contributions.size())));
    }

    public static List<Contributor> topContributors(AttackTree tree, int k) {
        return topContributors(tree.getNodes(), k);
    }

    private static final class ProbabilityWalk {
        private final Map<String, AttackNode> nodes;
        private final int maxDepth;
        private final Set<String> path = new HashSet<>();
        private final Map<String, Double> memo = new HashMap<>();

        ProbabilityWalk(Map<String, AttackNode> nodes, int maxDepth) {
            this.nodes = nodes;
            this.maxDepth = maxDepth;
        }

        double probability(String nodeId, String parentId, int depth) {
            Double cached = memo.get(nodeId);
            if (cached != null) {
                return cached;
            }
            AttackNode node = nodes.get(nodeId);
            if (node == null) {
                throw new SpecException(parentId == null
                    ? "Корневой узел '" + nodeId + "' отсутствует"
                    : String.format("Узел '%s' ссылается на неизвестный дочерний узел '%s'", parentId, nodeId));
            }
            if (depth > maxDepth) {
                throw new CycleException(nodeId, String.format(
                    "Превышена допустимая глубина дерева (%d) на узле '%s'", maxDepth, nodeId));
            }
            if (!path.add(nodeId)) {
                throw new CycleException(nodeId, "Обнаружен цикл через узел '" + nodeId + "'");
            }
            double result = evaluate(node, depth);
            path.remove(nodeId);
            memo.put(nodeId, result);
            return result;
        }

        private double evaluate(AttackNode node, int depth) {
            NodeKind kind = node.getKind();
            if (kind == null) {
                throw new InvalidNodeException(node.getId(), node.getType());
            }
            return switch (kind) {
                case LEAF -> {
                    if (node.getProbability() == null) {
                        throw new MissingValueException(node.getId(), "prob");
                    }
                    yield node.getProbability();
                }
                case AND -> {
                    double product = 1.0;
                    for (String childId : node.getChildren()) {
                        product *= probability(childId, node.getId(), depth + 1);
                    }
                    yield product;
                }
                case OR -> {
                    double none = 1.0;
                    for (String childId : node.getChildren()) {
                        none *= 1.0 - probability(childId, node.getId(), depth + 1);
                    }
                    yield 1.0 - none;
                }
            };
        }
    }
}
