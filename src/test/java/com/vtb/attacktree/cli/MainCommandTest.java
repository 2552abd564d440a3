package com.vtb.attacktree.cli;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.AttackTreeLoader;
import com.vtb.attacktree.models.AttackTree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Тесты для CLI
 */
class MainCommandTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    @Test
    void testDemoRun() {
        int code = run("--demo", "post", "-n", "2");

        assertEquals(MainCommand.EXIT_OK, code, stderr());
        assertTrue(stdout().contains("Вероятность верхнего события"), stdout());
        assertTrue(stdout().contains("2. "), stdout());
        assertFalse(stdout().contains("3. "), stdout());
    }

    @Test
    void testNoInput() {
        assertEquals(MainCommand.EXIT_INPUT_ERROR, run());
        assertTrue(stderr().contains("--demo"));
    }

    @Test
    void testMissingFile(@TempDir Path dir) {
        int code = run(dir.resolve("absent.yaml").toString());

        assertEquals(MainCommand.EXIT_INPUT_ERROR, code);
        assertTrue(stderr().contains("Ошибка загрузки"), stderr());
    }

    @Test
    void testMalformedSpec() throws Exception {
        int code = run(specPath("broken.yaml"));

        assertEquals(MainCommand.EXIT_INPUT_ERROR, code);
        assertTrue(stderr().contains("Ошибка спецификации"), stderr());
    }

    @Test
    void testIncompleteSpecReportsUnavailableResults() throws Exception {
        int code = run(specPath("incomplete.yaml"));

        assertEquals(MainCommand.EXIT_RESULTS_UNAVAILABLE, code);
        assertTrue(stdout().contains("Результаты недоступны"), stdout());
    }

    @Test
    void testExplicitFormat(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("tree.data");
        Files.writeString(file, "{\"id\": \"r\", \"type\": \"LEAF\", \"prob\": 0.3, \"impact\": 10}");

        assertEquals(MainCommand.EXIT_OK, run(file.toString(), "--format", "json"), stderr());
        assertTrue(stdout().contains("0.300000"), stdout());
    }

    @Test
    void testExplicitFormatMissingFile(@TempDir Path dir) {
        int code = run(dir.resolve("absent.data").toString(), "--format", "json");

        assertEquals(MainCommand.EXIT_INPUT_ERROR, code);
        assertTrue(stderr().contains("Файл не найден"), stderr());
    }

    @Test
    void testUnknownLeafForSensitivity() {
        int code = run("--demo", "pre", "--leaf", "compromise_business", "-m", "2");

        assertEquals(MainCommand.EXIT_INPUT_ERROR, code);
        assertTrue(stderr().contains("compromise_business"), stderr());
    }

    @Test
    void testCommitExportAndJson(@TempDir Path dir) throws IOException {
        Path yaml = dir.resolve("updated_spec.yaml");
        Path json = dir.resolve("reports/report.json");

        int code = run("--demo", "post", "--leaf", "sql_injection", "-m", "2", "--commit",
            "-e", yaml.toString(), "-j", json.toString());

        assertEquals(MainCommand.EXIT_OK, code, stderr());
        assertTrue(stdout().contains("Изменение применено"), stdout());
        assertTrue(Files.exists(json));

        AttackTree exported = new AttackTreeLoader(AnalyzerConfig.defaults()).loadFromFile(yaml);
        assertEquals(0.3, exported.getNode("sql_injection").getProbability(), 1e-9);
    }

    private int run(String... args) {
        MainCommand command = new MainCommand().withStreams(
            new PrintStream(out, true, StandardCharsets.UTF_8),
            new PrintStream(err, true, StandardCharsets.UTF_8));
        return new CommandLine(command).execute(args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    private static String specPath(String name) throws Exception {
        return Paths.get(MainCommandTest.class.getClassLoader().getResource("specs/" + name).toURI()).toString();
    }
}
