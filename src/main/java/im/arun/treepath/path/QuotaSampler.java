package im.arun.treepath.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Uniform sampling without replacement, and tiered selection under a quota.
 */
public class QuotaSampler {

    private final Random random;

    public QuotaSampler(Random random) {
        this.random = random;
    }

    /**
     * Seeded sampler, or an unseeded one when {@code seed} is null.
     */
    public static QuotaSampler of(Long seed) {
        return new QuotaSampler(seed != null ? new Random(seed) : new Random());
    }

    /**
     * Pick {@code k} distinct items uniformly at random. When {@code k} covers the whole
     * list, the items are returned in their original order and no randomness is used.
     */
    public <T> List<T> sample(List<T> items, int k) {
        if (k < 0) {
            throw new IllegalArgumentException("Sample size must not be negative: " + k);
        }
        if (k >= items.size()) {
            return new ArrayList<>(items);
        }

        // partial Fisher-Yates
        List<T> pool = new ArrayList<>(items);
        for (int i = 0; i < k; i++) {
            int j = i + random.nextInt(pool.size() - i);
            T swap = pool.get(i);
            pool.set(i, pool.get(j));
            pool.set(j, swap);
        }
        return new ArrayList<>(pool.subList(0, k));
    }

    /**
     * Fill up to {@code threshold} items, taking tiers in priority order. The first tier is
     * sampled down if it alone exceeds the threshold; each later tier only tops up the
     * remaining margin.
     */
    @SafeVarargs
    public final <T> List<T> selectWithQuota(int threshold, List<T>... tiers) {
        List<T> selected = new ArrayList<>();
        for (List<T> tier : tiers) {
            int margin = threshold - selected.size();
            if (margin <= 0) {
                break;
            }
            selected.addAll(sample(tier, Math.min(margin, tier.size())));
        }
        return selected;
    }
}
