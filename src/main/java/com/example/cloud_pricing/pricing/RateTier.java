package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;

/**
 * One pricing bracket: spend in {@code [lower, upper]} (inclusive, whole dollars) is billed
 * at {@code rate} per dollar.
 */
public record RateTier(long lower, long upper, BigDecimal rate) {

    public static RateTier of(long lower, long upper, String rate) {
        return new RateTier(lower, upper, new BigDecimal(rate));
    }

    /**
     * Dollar width of the bracket. The first tier starts at 0, so its capacity is its upper bound.
     */
    public BigDecimal capacity() {
        return BigDecimal.valueOf(upper - lower);
    }
}
