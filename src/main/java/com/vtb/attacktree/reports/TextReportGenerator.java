package com.vtb.attacktree.reports;

import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.AttackNode;
import com.vtb.attacktree.models.Contributor;
import com.vtb.attacktree.models.RiskSummary;
import com.vtb.attacktree.models.SensitivityResult;

import java.util.Locale;

/**
 * Текстовый отчет для консоли
 */
public class TextReportGenerator implements ReportGenerator {

    private static final String NOT_SET = "—";

    @Override
    public String render(AnalysisReport report) {
        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }
        StringBuilder sb = new StringBuilder();
        RiskSummary summary = report.getSummary();
        sb.append("Дерево атак: ").append(report.getSource()).append('\n');
        if (summary == null) {
            return sb.toString();
        }
        sb.append("Корень: ").append(summary.getRootId());
        if (summary.getRootLabel() != null) {
            sb.append(" (").append(summary.getRootLabel()).append(')');
        }
        sb.append(", узлов: ").append(summary.getNodeCount()).append('\n');

        sb.append("\nЛистья:\n");
        for (AttackNode leaf : summary.getLeaves()) {
            sb.append(String.format(Locale.ROOT, "  %-20s p=%-8s ущерб=%s%n",
                leaf.getId(), format(leaf.getProbability()), format(leaf.getImpact())));
        }

        sb.append('\n');
        if (!summary.isAvailable()) {
            sb.append("Результаты недоступны: ").append(summary.getUnavailableReason()).append('\n');
        } else {
            sb.append(String.format(Locale.ROOT, "Вероятность верхнего события: %.6f%n",
                summary.getTopEventProbability()));
            sb.append(String.format(Locale.ROOT, "Ожидаемый ущерб: %.2f%n", summary.getExpectedLoss()));
            sb.append("Наибольший вклад:\n");
            int rank = 1;
            for (Contributor contributor : summary.getTopContributors()) {
                sb.append(String.format(Locale.ROOT, "  %d. %s (%s): %.4f%n", rank++,
                    contributor.getId(), contributor.getLabel(), contributor.getValue()));
            }
        }

        SensitivityResult sensitivity = report.getSensitivity();
        if (sensitivity != null) {
            sb.append(String.format(Locale.ROOT,
                "%nЧувствительность: лист %s x%s, p %.4f -> %.4f%n",
                sensitivity.getLeafId(), sensitivity.getMultiplier(),
                sensitivity.getBaseProbability(), sensitivity.getAdjustedProbability()));
            sb.append(String.format(Locale.ROOT, "  Вероятность верхнего события: %.6f%n",
                sensitivity.getTopEventProbability()));
            sb.append(String.format(Locale.ROOT, "  Ожидаемый ущерб: %.2f%n", sensitivity.getExpectedLoss()));
            sb.append(report.isSensitivityCommitted() ? "  Изменение применено\n" : "  Предварительный расчёт\n");
        }
        return sb.toString();
    }

    @Override
    public String getFileExtension() {
        return "txt";
    }

    private String format(Double value) {
        return value == null ? NOT_SET : String.format(Locale.ROOT, "%s", value);
    }
}
