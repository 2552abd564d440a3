package com.vtb.attacktree.cli;

import com.vtb.attacktree.config.AnalyzerConfig;
import com.vtb.attacktree.core.AttackTreeAnalyzer;
import com.vtb.attacktree.errors.AttackTreeException;
import com.vtb.attacktree.errors.FormatException;
import com.vtb.attacktree.errors.NodeNotFoundException;
import com.vtb.attacktree.errors.SpecException;
import com.vtb.attacktree.models.AnalysisReport;
import com.vtb.attacktree.models.AttackTree;
import com.vtb.attacktree.models.RiskSummary;
import com.vtb.attacktree.models.SensitivityResult;
import com.vtb.attacktree.reports.JsonReportGenerator;
import com.vtb.attacktree.reports.TextReportGenerator;
import com.vtb.attacktree.reports.YamlSpecExporter;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда анализатора деревьев атак
 */
@Slf4j
@Command(
    name = "attack-tree",
    mixinStandardHelpOptions = true,
    version = "VTB Attack Tree Analyzer 1.0.0",
    description = """

        VTB Attack Tree Analyzer

        Количественный анализ деревьев атак

        Возможности:
          • Загрузка спецификаций YAML / JSON / XML
          • Вероятность верхнего события (AND / OR)
          • Ожидаемый ущерб и рейтинг вкладов листьев
          • Анализ чувствительности "что если"
          • Экспорт обновлённой спецификации в YAML

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_RESULTS_UNAVAILABLE = 1;
    static final int EXIT_INPUT_ERROR = 2;

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Путь к файлу спецификации дерева атак (YAML/JSON/XML)"
    )
    private String specificationPath;

    @Option(
        names = {"--demo"},
        description = "Загрузить встроенный сценарий: pre или post"
    )
    private String demo;

    @Option(
        names = {"-f", "--format"},
        description = "Формат файла (yaml, yml, json, xml); по умолчанию по расширению"
    )
    private String format;

    @Option(
        names = {"-n", "--top"},
        description = "Сколько листьев показать в рейтинге вкладов (по умолчанию из конфигурации)"
    )
    private Integer top;

    @Option(
        names = {"--leaf"},
        description = "Лист для анализа чувствительности"
    )
    private String leafId;

    @Option(
        names = {"-m", "--multiplier"},
        description = "Коэффициент для вероятности листа (по умолчанию из конфигурации)"
    )
    private Double multiplier;

    @Option(
        names = {"--commit"},
        description = "Записать результат анализа чувствительности в спецификацию"
    )
    private boolean commit = false;

    @Option(
        names = {"-e", "--export"},
        description = "Сохранить спецификацию в YAML"
    )
    private String exportPath;

    @Option(
        names = {"-j", "--json"},
        description = "Сохранить отчет в JSON"
    )
    private String jsonPath;

    private PrintStream out = System.out;
    private PrintStream err = System.err;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    MainCommand withStreams(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
        return this;
    }

    @Override
    public Integer call() {
        AnalyzerConfig config = AnalyzerConfig.load();
        AttackTreeAnalyzer analyzer = new AttackTreeAnalyzer(config);

        // 1. Загрузка
        AttackTree tree;
        String source;
        try {
            if (demo != null) {
                source = "demo:" + demo;
                tree = analyzer.getLoader().loadDemo(demo);
            } else if (specificationPath != null) {
                source = specificationPath;
                tree = loadFile(analyzer, Paths.get(specificationPath));
            } else {
                err.println("Ошибка: укажите файл спецификации или --demo");
                return EXIT_INPUT_ERROR;
            }
        } catch (FormatException | SpecException e) {
            log.error("Спецификация отклонена: {}", e.getMessage());
            err.println("Ошибка спецификации: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        } catch (IllegalArgumentException | IOException e) {
            log.error("Не удалось загрузить спецификацию: {}", e.getMessage());
            err.println("Ошибка загрузки: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        // 2. Чувствительность
        SensitivityResult sensitivity = null;
        if (leafId != null) {
            double factor = multiplier != null ? multiplier : config.getSensitivity().getDefaultMultiplier();
            try {
                sensitivity = analyzer.previewSensitivity(tree, leafId, factor);
                if (commit) {
                    analyzer.commitSensitivity(tree, sensitivity);
                }
            } catch (NodeNotFoundException | IllegalArgumentException e) {
                err.println("Ошибка анализа чувствительности: " + e.getMessage());
                return EXIT_INPUT_ERROR;
            } catch (AttackTreeException e) {
                log.warn("Анализ чувствительности невозможен: {}", e.getMessage());
                err.println("Анализ чувствительности невозможен: " + e.getMessage());
            }
        }

        // 3. Итоги и отчеты
        RiskSummary summary = top != null
            ? analyzer.summarize(tree, Math.max(0, top))
            : analyzer.summarize(tree);
        AnalysisReport report = AnalysisReport.builder()
            .source(source)
            .summary(summary)
            .sensitivity(sensitivity)
            .sensitivityCommitted(sensitivity != null && commit)
            .build();

        out.print(new TextReportGenerator().render(report));

        try {
            if (jsonPath != null) {
                new JsonReportGenerator().generate(report, Paths.get(jsonPath));
                out.println("JSON отчет: " + jsonPath);
            }
            if (exportPath != null) {
                new YamlSpecExporter().export(tree, Paths.get(exportPath));
                out.println("Спецификация: " + exportPath);
            }
        } catch (IOException e) {
            log.error("Ошибка записи: {}", e.getMessage());
            err.println("Ошибка записи: " + e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        return summary.isAvailable() ? EXIT_OK : EXIT_RESULTS_UNAVAILABLE;
    }

    private AttackTree loadFile(AttackTreeAnalyzer analyzer, Path path) throws IOException {
        if (format == null) {
            return analyzer.getLoader().loadFromFile(path);
        }
        return analyzer.getLoader().parse(path, format);
    }
}
