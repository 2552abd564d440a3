package com.vtb.attacktree.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.parser.SpecFormat;
import com.vtb.attacktree.parser.SpecReaders;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;

/**
 * Загрузка спецификаций: текст или файл -> читатель формата -> нормализатор.
 * Дерево возвращается только полностью проверенным.
 */
@Slf4j
public class AttackTreeLoader {

    private static final Map<String, String> DEMO_SCENARIOS = Map.of(
        "pre", "demo/pre_digital.yaml",
        "post", "demo/post_digital.yaml");

    private final AnalyzerConfig config;
    private final SpecNormalizer normalizer = new SpecNormalizer();

    public AttackTreeLoader() {
        this(AnalyzerConfig.load());
    }

    public AttackTreeLoader(AnalyzerConfig config) {
        this.config = config;
    }

    /**
     * Разобрать текст спецификации в формате, заданном тегом (yaml, yml, json, xml)
     */
    public AttackTree parse(String text, String formatTag) {
        SpecFormat format = SpecFormat.fromTag(formatTag);
        JsonNode generic = SpecReaders.forFormat(format).read(text);
        AttackTree tree = normalizer.normalize(generic);
        log.info("Загружено дерево атак '{}' ({}): {} узлов, {} листьев",
            tree.getRootId(), format, tree.size(), tree.getLeaves().size());
        return tree;
    }

    public AttackTree parse(byte[] content, String formatTag) {
        if (content == null) {
            throw new IllegalArgumentException("Содержимое спецификации не может быть null");
        }
        return parse(new String(content, StandardCharsets.UTF_8), formatTag);
    }

    /**
     * Загрузить файл; формат определяется по расширению
     */
    public AttackTree loadFromFile(Path path) throws IOException {
        checkFile(path);
        SpecFormat format = SpecFormat.fromFileName(path.getFileName().toString());
        return parse(Files.readAllBytes(path), format.getTags().get(0));
    }

    /**
     * Загрузить файл в явно заданном формате независимо от расширения
     */
    public AttackTree parse(Path path, String formatTag) throws IOException {
        checkFile(path);
        return parse(Files.readAllBytes(path), formatTag);
    }

    private void checkFile(Path path) throws IOException {
        if (path == null) {
            throw new IllegalArgumentException("Путь к файлу не может быть null");
        }
        log.info("Загрузка спецификации: {}", path);
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("Файл не найден: " + path);
        }
        if (!Files.isRegularFile(path)) {
            throw new IllegalArgumentException("Путь не является файлом: " + path);
        }
        long size = Files.size(path);
        long limit = config.getLoader().maxFileSizeBytes();
        if (size > limit) {
            throw new IllegalArgumentException(String.format(Locale.ROOT,
                "Файл слишком большой: %.2f MB (максимум: %d MB)",
                size / (1024.0 * 1024.0), config.getLoader().getMaxFileSizeMb()));
        }
    }

    /**
     * Загрузить встроенный демонстрационный сценарий ("pre" или "post")
     */
    public AttackTree loadDemo(String scenario) throws IOException {
        String key = scenario == null ? "" : scenario.trim().toLowerCase(Locale.ROOT);
        String resource = DEMO_SCENARIOS.get(key);
        if (resource == null) {
            throw new IllegalArgumentException("Неизвестный демонстрационный сценарий '" + scenario + "'");
        }
        try (InputStream is = AttackTreeLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " не найден в classpath");
            }
            log.info("Загрузка демонстрационного сценария {}", resource);
            return parse(is.readAllBytes(), "yaml");
        }
    }
}
