package com.example.cloud_pricing.pricing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the rate card and the engine once at startup.
 * An invalid substitute table fails the context with {@link TierTableException}.
 */
@Configuration
public class PricingConfig {

    private static final Logger log = LoggerFactory.getLogger(PricingConfig.class);

    @Bean
    public TierTable tierTable(PricingProperties props) {
        TierTable table = props.hasCustomTiers()
                ? TierTable.of(props.getEffectiveTableVersion(), props.toRateTiers())
                : ReferenceTierTable.create();
        log.info("Loaded tier table {} ({} tiers, $0 - ${})", table.version(), table.size(), table.maxUpper());
        return table;
    }

    @Bean
    public PricingEngine pricingEngine(TierTable tierTable, PricingProperties props) {
        return new PricingEngine(tierTable,
                props.getMinimumInvoice(),
                props.getMinimumInvoiceCeiling(),
                props.getUpgradeThreshold());
    }
}
