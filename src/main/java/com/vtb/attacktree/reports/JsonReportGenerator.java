package com.vtb.attacktree.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.RiskSummary;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public String render(AnalysisReport report) throws IOException {
        if (report == null) {
            throw new IllegalArgumentException("AnalysisReport не может быть null");
        }
        return objectMapper.writeValueAsString(sanitize(report));
    }

    @Override
    public void generate(AnalysisReport report, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);
        ReportGenerator.super.generate(report, outputPath);
        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    private AnalysisReport sanitize(AnalysisReport report) {
        RiskSummary summary = report.getSummary();
        if (summary != null) {
            if (summary.getLeaves() == null) {
                summary.setLeaves(new ArrayList<>());
            }
            if (summary.getTopContributors() == null) {
                summary.setTopContributors(new ArrayList<>());
            }
        }
        return report;
    }
}
