package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;
import java.util.List;

/**
 * Flex and commit pricing over a {@link TierTable}.
 *
 * <p>Every operation is a pure function of its arguments and the table, so one instance can
 * serve any number of concurrent callers. Amounts are exact; callers round for display.
 */
public class PricingEngine {

    public static final BigDecimal DEFAULT_MINIMUM_INVOICE = new BigDecimal("2500");
    public static final BigDecimal DEFAULT_MINIMUM_INVOICE_CEILING = new BigDecimal("125000");
    public static final BigDecimal DEFAULT_UPGRADE_THRESHOLD = new BigDecimal("0.8");

    private final TierTable table;
    private final BigDecimal minimumInvoice;
    private final BigDecimal minimumInvoiceCeiling;
    private final BigDecimal upgradeThreshold;

    public PricingEngine(TierTable table) {
        this(table, DEFAULT_MINIMUM_INVOICE, DEFAULT_MINIMUM_INVOICE_CEILING, DEFAULT_UPGRADE_THRESHOLD);
    }

    public PricingEngine(TierTable table, BigDecimal minimumInvoice, BigDecimal minimumInvoiceCeiling,
            BigDecimal upgradeThreshold) {
        if (table == null) {
            throw new IllegalArgumentException("tier table is required");
        }
        requireSetting(minimumInvoice, "minimumInvoice");
        requireSetting(minimumInvoiceCeiling, "minimumInvoiceCeiling");
        requireSetting(upgradeThreshold, "upgradeThreshold");
        this.table = table;
        this.minimumInvoice = minimumInvoice;
        this.minimumInvoiceCeiling = minimumInvoiceCeiling;
        this.upgradeThreshold = upgradeThreshold;
    }

    /**
     * Flex (pay as you go) price of a month's spend.
     *
     * <p>Spend fills the tiers from the bottom up, each slice billed at its own tier's rate.
     * Spend at or below the minimum-invoice ceiling is never billed less than the minimum
     * invoice.
     *
     * @throws IllegalArgumentException if spend is null or negative
     */
    public BigDecimal flexPrice(BigDecimal spend) {
        requireNonNegative(spend, "spend");
        BigDecimal total = tieredCost(spend);
        if (spend.compareTo(minimumInvoiceCeiling) <= 0) {
            return total.max(minimumInvoice);
        }
        return total;
    }

    /**
     * Sum of the tier slices for {@code spend}, before the minimum invoice. Spend above the
     * last tier is not billed.
     */
    public BigDecimal tieredCost(BigDecimal spend) {
        requireNonNegative(spend, "spend");
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal remaining = spend;
        for (RateTier tier : table.tiers()) {
            if (remaining.signum() <= 0) {
                break;
            }
            BigDecimal tierSpend = remaining.min(tier.capacity());
            total = total.add(tierSpend.multiply(tier.rate()));
            remaining = remaining.subtract(tierSpend);
        }
        return total;
    }

    /**
     * Commit price: the committed block is billed at the rate of the tier the commitment falls
     * in, capped at actual spend, and any spend above the commitment is priced as a separate
     * flex purchase starting again from the first tier.
     *
     * <p>A zero commitment is exactly {@link #flexPrice(BigDecimal)}.
     *
     * @throws IllegalArgumentException if either amount is null or negative
     */
    public BigDecimal commitPrice(BigDecimal spend, BigDecimal commitAmount) {
        requireNonNegative(spend, "spend");
        requireNonNegative(commitAmount, "commitAmount");
        if (commitAmount.signum() == 0) {
            return flexPrice(spend);
        }

        BigDecimal committed = spend.min(commitAmount).multiply(commitTier(commitAmount).rate());
        BigDecimal overflow = spend.compareTo(commitAmount) > 0
                ? flexPrice(spend.subtract(commitAmount))
                : BigDecimal.ZERO;
        return committed.add(overflow);
    }

    /**
     * Tier whose rate applies to a commitment: the first tier reaching {@code commitAmount},
     * or the last tier for commitments above the table.
     */
    public RateTier commitTier(BigDecimal commitAmount) {
        requireNonNegative(commitAmount, "commitAmount");
        int idx = table.indexOfFirstUpperAtLeast(commitAmount);
        return idx < 0 ? table.last() : table.get(idx);
    }

    /**
     * Suggested commitment for a spend level. Spend in the top part of its tier (above
     * {@code upgradeThreshold} of the tier ceiling) is pointed at the next tier's ceiling;
     * otherwise the current tier's ceiling is returned.
     *
     * <p>The current tier is the one whose {@code [lower, upper]} contains spend. Spend that no
     * tier contains (above the table, or a fractional amount between two whole-dollar tiers
     * such as 125,000.5) is treated as last-tier spend.
     *
     * @throws IllegalArgumentException if spend is null or negative
     */
    public long recommendCommitTier(BigDecimal spend) {
        requireNonNegative(spend, "spend");
        int idx = table.indexOfFirstUpperAtLeast(spend);
        if (idx < 0 || spend.compareTo(BigDecimal.valueOf(table.get(idx).lower())) < 0) {
            idx = table.size() - 1;
        }
        RateTier current = table.get(idx);
        boolean hasNext = idx + 1 < table.size();
        BigDecimal upgradeAt = BigDecimal.valueOf(current.upper()).multiply(upgradeThreshold);
        if (hasNext && spend.compareTo(upgradeAt) > 0) {
            return table.get(idx + 1).upper();
        }
        return current.upper();
    }

    public List<RateTier> listTiers() {
        return table.tiers();
    }

    public TierTable getTable() {
        return table;
    }

    private static void requireSetting(BigDecimal value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private static void requireNonNegative(BigDecimal amount, String name) {
        if (amount == null) {
            throw new IllegalArgumentException(name + " is required");
        }
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + amount.toPlainString());
        }
    }
}
