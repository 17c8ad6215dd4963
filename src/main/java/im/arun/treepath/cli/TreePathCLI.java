package im.arun.treepath.cli;

import im.arun.treepath.config.ConfigLoader;
import im.arun.treepath.config.TreePathConfig;
import im.arun.treepath.model.CodeUnit;
import im.arun.treepath.model.CoverageStats;
import im.arun.treepath.model.FeatureMode;
import im.arun.treepath.model.PathStyle;
import im.arun.treepath.model.TreeStyle;
import im.arun.treepath.parse.ParseTreeReader;
import im.arun.treepath.service.TreePathService;
import im.arun.treepath.stats.CoverageAggregator;
import im.arun.treepath.stats.DegenerateTreeException;
import im.arun.treepath.util.ExecutorProvider;
import im.arun.treepath.util.JsonReportWriter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Command-line interface for TreePath using Picocli.
 */
@Command(
    name = "treepath",
    description = "Extract root-path, leaf-path and serialized tree features from pre-parsed code units",
    mixinStandardHelpOptions = true,
    version = "TreePath 1.0"
)
public class TreePathCLI implements Callable<Integer> {

    static final String MODE_FEATURES = "features";
    static final String MODE_STATS = "stats";

    @Parameters(arity = "1..*", paramLabel = "INPUT", description = "Code unit files (.json or .jsonl)")
    private List<Path> inputs;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--tree-style"}, description = "Root path labels: ${COMPLETION-CANDIDATES}")
    private TreeStyle treeStyle;

    @Option(names = {"--path-style"}, description = "Leaf path middle rendering: ${COMPLETION-CANDIDATES}")
    private PathStyle pathStyle;

    @Option(names = {"--mode"}, description = "features, stats, code, rootpath, leafpath, sbt or lcrs", defaultValue = MODE_FEATURES)
    private String mode;

    @Option(names = {"--seed"}, description = "Seed for path sampling")
    private Long seed;

    @Option(names = {"--threads"}, description = "Worker threads, 0 for one per processor", defaultValue = "0")
    private int threads;

    @Option(names = {"--output"}, description = "Output JSON file path")
    private Path outputPath;

    @Override
    public Integer call() throws Exception {
        for (Path input : inputs) {
            if (!Files.exists(input)) {
                System.err.println("Error: input file not found: " + input);
                return 1;
            }
        }

        FeatureMode featureMode = null;
        if (!MODE_FEATURES.equals(mode) && !MODE_STATS.equals(mode)) {
            try {
                featureMode = FeatureMode.parse(mode);
            } catch (IllegalArgumentException e) {
                System.err.println("Error: " + e.getMessage());
                return 1;
            }
        }

        TreePathConfig config;
        List<CodeUnit> units = new ArrayList<>();
        try {
            config = new ConfigLoader(configPath).load(overrides());
            ParseTreeReader reader = new ParseTreeReader();
            for (Path input : inputs) {
                units.addAll(reader.readUnits(input));
            }
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error reading input: " + e.getMessage());
            return 1;
        }

        JsonReportWriter report = new JsonReportWriter();
        try {
            if (MODE_STATS.equals(mode)) {
                report.add(runStats(units, config));
            } else if (MODE_FEATURES.equals(mode)) {
                runPerUnit(units, config, (service, unit) -> service.extract(unit)).forEach(report::add);
            } else {
                FeatureMode tokensMode = featureMode;
                runPerUnit(units, config, (service, unit) -> service.docToTokens(unit, tokensMode)).forEach(report::add);
            }
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            System.err.println("Error processing code units: " + cause.getMessage());
            return 1;
        } catch (IllegalStateException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        if (outputPath != null) {
            report.writeTo(outputPath);
            System.err.println("Output written to: " + outputPath);
        } else {
            report.writeTo(System.out);
        }
        return 0;
    }

    private Map<String, Object> overrides() {
        Map<String, Object> options = new HashMap<>();
        options.put("treeStyle", treeStyle);
        options.put("pathStyle", pathStyle);
        options.put("seed", seed);
        return options;
    }

    /**
     * Run {@code task} on every unit in parallel and return the results in input order.
     * Each unit gets its own service; with a seed, unit {@code i} samples with {@code seed + i}.
     */
    private <T> List<T> runPerUnit(List<CodeUnit> units, TreePathConfig config, UnitTask<T> task) {
        ExecutorService executor = threads > 0 ? ExecutorProvider.getExecutor(threads) : ExecutorProvider.getExecutor();

        List<CompletableFuture<T>> futures = new ArrayList<>(units.size());
        for (int i = 0; i < units.size(); i++) {
            CodeUnit unit = units.get(i);
            TreePathService service = new TreePathService(unitConfig(config, i));
            futures.add(CompletableFuture.supplyAsync(() -> task.apply(service, unit), executor));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        return futures.stream()
            .map(CompletableFuture::join)
            .collect(Collectors.toList());
    }

    private Map<String, Object> runStats(List<CodeUnit> units, TreePathConfig config) {
        List<CoverageStats> perUnit = runPerUnit(units, config, (service, unit) -> {
            try {
                return service.computeStats(unit);
            } catch (DegenerateTreeException e) {
                return null;
            }
        });

        CoverageAggregator aggregator = new CoverageAggregator();
        perUnit.forEach(aggregator::add);

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("tree_style", config.getTreeStyle());
        summary.put("path_style", config.getPathStyle());
        summary.put("units", aggregator.getUnitCount());
        summary.put("skipped", aggregator.getSkippedCount());
        summary.put("coverage", aggregator.average());
        return summary;
    }

    private static TreePathConfig unitConfig(TreePathConfig config, int unitIndex) {
        if (config.getSeed() == null) {
            return config;
        }
        TreePathConfig copy = ConfigLoader.copy(config);
        copy.setSeed(config.getSeed() + unitIndex);
        return copy;
    }

    @FunctionalInterface
    private interface UnitTask<T> {
        T apply(TreePathService service, CodeUnit unit);
    }

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = new CommandLine(new TreePathCLI())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        } finally {
            ExecutorProvider.shutdown();
        }
        System.exit(exitCode);
    }
}
