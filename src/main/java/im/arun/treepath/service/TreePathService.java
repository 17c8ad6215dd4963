package im.arun.treepath.service;

import im.arun.treepath.config.TreePathConfig;
import im.arun.treepath.model.CodeUnit;
import im.arun.treepath.model.CoverageStats;
import im.arun.treepath.model.FeatureMode;
import im.arun.treepath.model.LeafPath;
import im.arun.treepath.model.RootPath;
import im.arun.treepath.model.SyntaxTree;
import im.arun.treepath.model.UnitFeatures;
import im.arun.treepath.normalize.Normalizer;
import im.arun.treepath.normalize.PassThroughNormalizer;
import im.arun.treepath.parse.ParseNode;
import im.arun.treepath.path.ExtractionSession;
import im.arun.treepath.path.PathExtractor;
import im.arun.treepath.path.QuotaSampler;
import im.arun.treepath.stats.CoverageAggregator;
import im.arun.treepath.stats.CoverageAnalyzer;
import im.arun.treepath.stats.DegenerateTreeException;
import im.arun.treepath.tree.TreeBuilder;
import im.arun.treepath.tree.TreeSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Main service orchestrator: rebuilds each code unit's parse tree and derives its
 * path tokens, serializations and coverage. Units never share state; each call
 * works on a fresh tree and {@link ExtractionSession}.
 * One instance draws all its samples from a single random source, so it is not
 * meant to be shared between threads.
 */
public class TreePathService {
    private static final Logger logger = LoggerFactory.getLogger(TreePathService.class);

    private final TreePathConfig config;
    private final TreeBuilder treeBuilder;
    private final PathExtractor pathExtractor;
    private final TreeSerializer treeSerializer;
    private final CoverageAnalyzer coverageAnalyzer;

    public TreePathService(TreePathConfig config) {
        this(config, new PassThroughNormalizer());
    }

    public TreePathService(TreePathConfig config, Normalizer normalizer) {
        this(config, normalizer, QuotaSampler.of(config.getSeed()));
    }

    public TreePathService(TreePathConfig config, Normalizer normalizer, QuotaSampler sampler) {
        this.config = config;
        this.treeBuilder = new TreeBuilder(normalizer);
        this.pathExtractor = new PathExtractor(config, sampler);
        this.treeSerializer = new TreeSerializer(config.getLcrsDepthLimit());
        this.coverageAnalyzer = new CoverageAnalyzer();
    }

    public SyntaxTree buildTree(CodeUnit unit) {
        if (unit.getTree() == null) {
            throw new IllegalArgumentException("Code unit carries no parse tree");
        }
        return treeBuilder.build(unit.getTree(), unit.getCode());
    }

    /**
     * Every feature of one unit. Coverage is left null when the tree is too small
     * to measure.
     */
    public UnitFeatures extract(CodeUnit unit) {
        return extract(buildTree(unit), unit.getLanguage());
    }

    public UnitFeatures extract(ParseNode parseRoot, String code, String language) {
        return extract(treeBuilder.build(parseRoot, code), language);
    }

    private UnitFeatures extract(SyntaxTree tree, String language) {
        ExtractionSession session = new ExtractionSession();
        List<RootPath> rootPaths = pathExtractor.generateRootPaths(tree, session);
        List<LeafPath> leafPaths = pathExtractor.generateLeafPaths(rootPaths, session);

        UnitFeatures features = new UnitFeatures();
        features.setLanguage(language);
        features.setRootPathTokens(rootPathTokens(rootPaths));
        features.setLeafPathTokens(leafPathTokens(leafPaths));
        features.setSbtTokens(treeSerializer.sbtTokens(tree.getRoot()));
        features.setLcrsTokens(treeSerializer.lcrsTokens(tree.getRoot()));

        try {
            features.setCoverage(coverageAnalyzer.analyze(session, tree.getEldestCount()));
        } catch (DegenerateTreeException e) {
            logger.warn("Skipping coverage: {}", e.getMessage());
        }
        return features;
    }

    /**
     * Flat path tokens of one unit.
     *
     * @param mode {@link FeatureMode#ROOTPATH} or {@link FeatureMode#LEAFPATH}
     */
    public List<String> codeToPaths(CodeUnit unit, FeatureMode mode) {
        SyntaxTree tree = buildTree(unit);
        ExtractionSession session = new ExtractionSession();

        switch (mode) {
            case ROOTPATH:
                return rootPathTokens(pathExtractor.generateRootPaths(tree, session));
            case LEAFPATH:
                return leafPathTokens(pathExtractor.generateLeafPaths(tree, session));
            default:
                throw new IllegalArgumentException("Not a path mode: " + mode);
        }
    }

    /**
     * Tokens of one unit in the requested feature form.
     */
    public List<String> docToTokens(CodeUnit unit, FeatureMode mode) {
        switch (mode) {
            case CODE:
                if (unit.getCodeTokens() == null) {
                    throw new IllegalArgumentException("Code unit carries no code tokens");
                }
                return unit.getCodeTokens();
            case ROOTPATH:
            case LEAFPATH:
                return codeToPaths(unit, mode);
            case SBT:
                return treeSerializer.sbtTokens(buildTree(unit).getRoot());
            case LCRS:
                return treeSerializer.lcrsTokens(buildTree(unit).getRoot());
            default:
                throw new IllegalArgumentException("Unsupported feature mode: " + mode);
        }
    }

    /**
     * Coverage of the paths sampled from one unit.
     *
     * @throws DegenerateTreeException if the tree is too small to measure
     */
    public CoverageStats computeStats(CodeUnit unit) {
        SyntaxTree tree = buildTree(unit);
        ExtractionSession session = new ExtractionSession();
        // root paths are generated on the way
        pathExtractor.generateLeafPaths(tree, session);
        return coverageAnalyzer.analyze(session, tree.getEldestCount());
    }

    /**
     * Coverage averaged over {@code units}; degenerate units are skipped.
     */
    public CoverageStats runStats(Collection<CodeUnit> units) {
        CoverageAggregator aggregator = new CoverageAggregator();
        for (CodeUnit unit : units) {
            try {
                aggregator.add(computeStats(unit));
            } catch (DegenerateTreeException e) {
                logger.warn("Skipping unit: {}", e.getMessage());
                aggregator.add(null);
            }
        }
        logger.info("Computed coverage for {} units of style {}/{}",
            aggregator.getUnitCount(), config.getTreeStyle(), config.getPathStyle());
        return aggregator.average();
    }

    static List<String> rootPathTokens(List<RootPath> rootPaths) {
        List<String> tokens = new ArrayList<>();
        for (RootPath rootPath : rootPaths) {
            tokens.addAll(rootPath.getLabels());
            tokens.addAll(rootPath.getAnchorTokens());
        }
        return tokens;
    }

    static List<String> leafPathTokens(List<LeafPath> leafPaths) {
        List<String> tokens = new ArrayList<>();
        for (LeafPath leafPath : leafPaths) {
            tokens.addAll(leafPath.getTokens());
        }
        return tokens;
    }

    public TreePathConfig getConfig() {
        return config;
    }
}
