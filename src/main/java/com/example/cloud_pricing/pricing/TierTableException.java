package com.example.cloud_pricing.pricing;

/**
 * Raised when a tier definition cannot be used as a {@link TierTable}.
 */
public class TierTableException extends RuntimeException {

    public enum Violation {
        EMPTY,
        NON_ZERO_START,
        INVALID_BOUNDS,
        NON_POSITIVE_RATE,
        NOT_ASCENDING,
        GAP_OR_OVERLAP
    }

    private final Violation violation;
    private final int tierIndex;

    public TierTableException(Violation violation, int tierIndex, String message) {
        super(message);
        this.violation = violation;
        this.tierIndex = tierIndex;
    }

    public Violation getViolation() {
        return violation;
    }

    /**
     * Index of the offending tier, or -1 when the violation concerns the whole table.
     */
    public int getTierIndex() {
        return tierIndex;
    }
}
