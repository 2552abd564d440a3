package com.vtb.attacktree.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;

/**
 * Конфигурация анализатора из YAML файла в classpath
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalyzerConfig {

    public static final String RESOURCE = "analyzer-config.yaml";

    private Evaluation evaluation;
    private Loader loader;
    private Sensitivity sensitivity;

    private static AnalyzerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized AnalyzerConfig load() {
        if (instance == null) {
            instance = load(RESOURCE);
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из указанного ресурса без кеширования
     */
    public static AnalyzerConfig load(String resource) {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        try (InputStream is = AnalyzerConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            AnalyzerConfig config = mapper.readValue(is, AnalyzerConfig.class);
            if (config == null) {
                config = new AnalyzerConfig();
            }
            config.ensureDefaults();
            log.debug("Конфигурация загружена из {}: {}", resource, config);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
        }
    }

    /**
     * Конфигурация со значениями по умолчанию, без чтения ресурсов
     */
    public static AnalyzerConfig defaults() {
        AnalyzerConfig config = new AnalyzerConfig();
        config.ensureDefaults();
        return config;
    }

    private void ensureDefaults() {
        if (evaluation == null) {
            evaluation = new Evaluation();
        }
        evaluation.ensureDefaults();
        if (loader == null) {
            loader = new Loader();
        }
        loader.ensureDefaults();
        if (sensitivity == null) {
            sensitivity = new Sensitivity();
        }
        sensitivity.ensureDefaults();
    }

    @Data
    public static class Evaluation {
        private static final int DEFAULT_MAX_DEPTH = 1_000;
        private static final int DEFAULT_TOP_CONTRIBUTORS = 3;

        private Integer maxDepth;
        private Integer topContributors;

        void ensureDefaults() {
            if (maxDepth == null || maxDepth <= 0) {
                maxDepth = DEFAULT_MAX_DEPTH;
            }
            if (topContributors == null || topContributors < 0) {
                topContributors = DEFAULT_TOP_CONTRIBUTORS;
            }
        }
    }

    @Data
    public static class Loader {
        private static final long DEFAULT_MAX_FILE_SIZE_MB = 10;

        private Long maxFileSizeMb;

        void ensureDefaults() {
            if (maxFileSizeMb == null || maxFileSizeMb <= 0) {
                maxFileSizeMb = DEFAULT_MAX_FILE_SIZE_MB;
            }
        }

        public long maxFileSizeBytes() {
            return maxFileSizeMb * 1024 * 1024;
        }
    }

    @Data
    public static class Sensitivity {
        private Double defaultMultiplier;

        void ensureDefaults() {
            if (defaultMultiplier == null || defaultMultiplier.isNaN() || defaultMultiplier.isInfinite()) {
                defaultMultiplier = 1.0;
            }
        }
    }
}
