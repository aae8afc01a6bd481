package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.example.cloud_pricing.pricing.TierTableException.Violation;

/**
 * Validated, immutable list of {@link RateTier}s ordered by spend.
 *
 * <p>A table starts at 0 and its tiers are contiguous: each tier begins one dollar above the
 * previous tier's upper bound. Instances are safe to share between threads.
 */
public final class TierTable {

    private final String version;
    private final List<RateTier> tiers;
    private final long[] uppers;

    private TierTable(String version, List<RateTier> tiers) {
        this.version = version;
        this.tiers = Collections.unmodifiableList(new ArrayList<>(tiers));
        this.uppers = tiers.stream().mapToLong(RateTier::upper).toArray();
    }

    /**
     * Validates {@code tiers} and wraps them in a table.
     *
     * @throws TierTableException naming the first violated rule
     */
    public static TierTable of(String version, List<RateTier> tiers) {
        validate(tiers);
        return new TierTable(version, tiers);
    }

    private static void validate(List<RateTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new TierTableException(Violation.EMPTY, -1, "tier table is empty");
        }
        RateTier previous = null;
        for (int i = 0; i < tiers.size(); i++) {
            RateTier t = tiers.get(i);
            if (t == null) {
                throw new TierTableException(Violation.INVALID_BOUNDS, i, "tier #" + i + " is null");
            }
            if (i == 0 && t.lower() != 0) {
                throw new TierTableException(Violation.NON_ZERO_START, 0,
                        "first tier must start at 0 but starts at " + t.lower());
            }
            if (t.upper() <= t.lower()) {
                throw new TierTableException(Violation.INVALID_BOUNDS, i,
                        "tier #" + i + " upper " + t.upper() + " is not above lower " + t.lower());
            }
            if (t.rate() == null || t.rate().signum() <= 0) {
                throw new TierTableException(Violation.NON_POSITIVE_RATE, i,
                        "tier #" + i + " rate must be positive: " + t.rate());
            }
            if (previous != null) {
                if (t.lower() <= previous.lower()) {
                    throw new TierTableException(Violation.NOT_ASCENDING, i,
                            "tier #" + i + " lower " + t.lower() + " is not above previous lower "
                                    + previous.lower());
                }
                if (t.lower() != previous.upper() + 1) {
                    throw new TierTableException(Violation.GAP_OR_OVERLAP, i,
                            "tier #" + i + " starts at " + t.lower() + ", expected " + (previous.upper() + 1));
                }
            }
            previous = t;
        }
    }

    public String version() {
        return version;
    }

    public List<RateTier> tiers() {
        return tiers;
    }

    public int size() {
        return tiers.size();
    }

    public RateTier get(int index) {
        return tiers.get(index);
    }

    public RateTier last() {
        return tiers.get(tiers.size() - 1);
    }

    public long maxUpper() {
        return last().upper();
    }

    /**
     * Index of the first tier whose upper bound is at least {@code amount}, or -1 when
     * {@code amount} is above the whole table.
     */
    public int indexOfFirstUpperAtLeast(BigDecimal amount) {
        int lo = 0;
        int hi = uppers.length - 1;
        int found = -1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            if (BigDecimal.valueOf(uppers[mid]).compareTo(amount) >= 0) {
                found = mid;
                hi = mid - 1;
            } else {
                lo = mid + 1;
            }
        }
        return found;
    }

    @Override
    public String toString() {
        return "TierTable[version=" + version + ", tiers=" + tiers.size() + ", max=" + maxUpper() + "]";
    }
}
