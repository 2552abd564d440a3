package com.vtb.attacktree.reports;

import com.vtb.attacktree.models.AnalysisReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Интерфейс для генераторов отчетов
 */
public interface ReportGenerator {

    /**
     * Содержимое отчета
     *
     * @param report результат анализа
     */
    String render(AnalysisReport report) throws IOException;

    /**
     * Сгенерировать отчет
     *
     * @param report результат анализа
     * @param outputPath путь для сохранения отчета
     * @throws IOException если произошла ошибка записи
     */
    default void generate(AnalysisReport report, Path outputPath) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, render(report));
    }

    /**
     * Получить расширение файла отчета
     */
    String getFileExtension();
}
