package com.vtb.attacktree.edit;

import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.AttackTree;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Правка вероятностей и ущерба листьев.
 *
 * Каждое поле проверяется отдельно: некорректное значение отклоняется с сообщением
 * и оставляет прежнее значение, остальные поля применяются (частичное применение).
 */
@Slf4j
public class LeafEditor {

    public static final String PROB_PREFIX = "prob_";
    public static final String IMPACT_PREFIX = "impact_";

    public EditOutcome apply(AttackTree tree, List<LeafEdit> edits) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        List<String> errors = new ArrayList<>();
        int updated = 0;
        for (LeafEdit edit : edits != null ? edits : List.<LeafEdit>of()) {
            if (edit == null) {
                continue;
            }
            AttackNode leaf = tree.getNode(edit.getLeafId());
            if (leaf == null || !leaf.isLeaf()) {
                errors.add("Узел " + edit.getLeafId() + " не является листом");
                continue;
            }
            if (acceptProbability(leaf, edit.getProbability(), errors)) {
                leaf.setProbability(edit.getProbability());
                updated++;
            }
            if (acceptImpact(leaf, edit.getImpact(), errors)) {
                leaf.setImpact(edit.getImpact());
                updated++;
            }
        }
        logOutcome(updated, errors);
        return EditOutcome.builder().updatedFields(updated).errors(errors).build();
    }

    /**
     * Применить значения формы вида {@code prob_<id>} / {@code impact_<id>} ко всем листьям.
     * Пустое поле очищает значение, нечисловое поле отклоняется.
     */
    public EditOutcome applyForm(AttackTree tree, Map<String, String> form) {
        if (tree == null) {
            throw new IllegalArgumentException("Дерево не может быть null");
        }
        Map<String, String> values = form != null ? form : Map.of();
        List<String> errors = new ArrayList<>();
        int updated = 0;

        for (AttackNode leaf : tree.getLeaves()) {
            ParsedField prob = parse(values.get(PROB_PREFIX + leaf.getId()),
                "Некорректная вероятность для " + leaf.getId(), errors);
            ParsedField impact = parse(values.get(IMPACT_PREFIX + leaf.getId()),
                "Некорректный ущерб для " + leaf.getId(), errors);

            if (prob.valid() && acceptProbability(leaf, prob.value(), errors)) {
                leaf.setProbability(prob.value());
                updated++;
            }
            if (impact.valid() && acceptImpact(leaf, impact.value(), errors)) {
                leaf.setImpact(impact.value());
                updated++;
            }
        }
        logOutcome(updated, errors);
        return EditOutcome.builder().updatedFields(updated).errors(errors).build();
    }

    private boolean acceptProbability(AttackNode leaf, Double value, List<String> errors) {
        if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
            errors.add("Вероятность для " + leaf.getId() + " должна быть в диапазоне от 0 до 1");
            return false;
        }
        return true;
    }

    private boolean acceptImpact(AttackNode leaf, Double value, List<String> errors) {
        if (value != null && (value.isNaN() || value.isInfinite() || value < 0.0)) {
            errors.add("Ущерб для " + leaf.getId() + " должен быть неотрицательным");
            return false;
        }
        return true;
    }

    private ParsedField parse(String raw, String error, List<String> errors) {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty()) {
            return new ParsedField(true, null);
        }
        try {
            return new ParsedField(true, Double.parseDouble(text));
        } catch (NumberFormatException e) {
            errors.add(error);
            return new ParsedField(false, null);
        }
    }

    private void logOutcome(int updated, List<String> errors) {
        log.info("Правка листьев: записано полей {}, отклонено {}", updated, errors.size());
        errors.forEach(error -> log.warn("Правка отклонена: {}", error));
    }

    private record ParsedField(boolean valid, Double value) {}
}
