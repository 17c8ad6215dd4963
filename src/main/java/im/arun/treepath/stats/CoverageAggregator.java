package im.arun.treepath.stats;

import im.arun.treepath.model.CoverageStats;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running average of coverage ratios over a corpus. Units whose coverage is undefined
 * are counted as skipped and left out of the averages.
 */
@Getter
public class CoverageAggregator {
    private static final Logger logger = LoggerFactory.getLogger(CoverageAggregator.class);

    private double sumLinkCoverageRootPath;
    private double sumLinkCoverageLeafPath;
    private double sumLinkCoverageLcrs;
    private double sumNodeCoverageRootPath;
    private double sumNodeCoverageLeafPath;
    private int unitCount;
    private int skippedCount;

    /**
     * @param stats coverage of one unit, or null when it could not be computed
     */
    public void add(CoverageStats stats) {
        if (stats == null) {
            skippedCount++;
            return;
        }
        sumLinkCoverageRootPath += stats.getLinkCoverageRootPath();
        sumLinkCoverageLeafPath += stats.getLinkCoverageLeafPath();
        sumLinkCoverageLcrs += stats.getLinkCoverageLcrs();
        sumNodeCoverageRootPath += stats.getNodeCoverageRootPath();
        sumNodeCoverageLeafPath += stats.getNodeCoverageLeafPath();
        unitCount++;
    }

    /**
     * @throws IllegalStateException if no unit had defined coverage
     */
    public CoverageStats average() {
        if (unitCount == 0) {
            throw new IllegalStateException("No code unit with measurable coverage (" + skippedCount + " skipped)");
        }
        if (skippedCount > 0) {
            logger.info("Averaged coverage over {} units, skipped {} degenerate units", unitCount, skippedCount);
        }
        return new CoverageStats(
            sumLinkCoverageRootPath / unitCount,
            sumLinkCoverageLeafPath / unitCount,
            sumLinkCoverageLcrs / unitCount,
            sumNodeCoverageRootPath / unitCount,
            sumNodeCoverageLeafPath / unitCount);
    }
}
