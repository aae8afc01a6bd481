package com.example.cloud_pricing.pricing;

import java.util.List;

/**
 * Published rate card. Change {@link #VERSION} whenever a bound or rate changes.
 */
public final class ReferenceTierTable {

    public static final String VERSION = "2024.1";

    // $0 - $250M, 26 tiers
    static final List<RateTier> TIERS = List.of(
            RateTier.of(0L, 125_000L, "0.0330"),
            RateTier.of(125_001L, 250_000L, "0.0315"),
            RateTier.of(250_001L, 416_667L, "0.0297"),
            RateTier.of(416_668L, 833_333L, "0.0264"),
            RateTier.of(833_334L, 1_666_667L, "0.0231"),
            RateTier.of(1_666_668L, 2_500_000L, "0.0215"),
            RateTier.of(2_500_001L, 3_333_333L, "0.0198"),
            RateTier.of(3_333_334L, 4_166_667L, "0.0182"),
            RateTier.of(4_166_668L, 6_250_000L, "0.0165"),
            RateTier.of(6_250_001L, 8_333_333L, "0.0132"),
            RateTier.of(8_333_334L, 12_500_000L, "0.0116"),
            RateTier.of(12_500_001L, 16_666_667L, "0.0107"),
            RateTier.of(16_666_668L, 20_833_333L, "0.0100"),
            RateTier.of(20_833_334L, 25_000_000L, "0.0095"),
            RateTier.of(25_000_001L, 29_166_667L, "0.0091"),
            RateTier.of(29_166_668L, 33_333_333L, "0.0088"),
            RateTier.of(33_333_334L, 41_666_667L, "0.0084"),
            RateTier.of(41_666_668L, 62_500_000L, "0.0069"),
            RateTier.of(62_500_001L, 83_333_333L, "0.0062"),
            RateTier.of(83_333_334L, 104_166_667L, "0.0054"),
            RateTier.of(104_166_668L, 125_000_000L, "0.0050"),
            RateTier.of(125_000_001L, 145_833_333L, "0.0046"),
            RateTier.of(145_833_334L, 166_666_667L, "0.0043"),
            RateTier.of(166_666_668L, 187_500_000L, "0.0040"),
            RateTier.of(187_500_001L, 208_333_333L, "0.0038"),
            RateTier.of(208_333_334L, 250_000_000L, "0.0034"));

    private ReferenceTierTable() {
    }

    public static TierTable create() {
        return TierTable.of(VERSION, TIERS);
    }
}
