package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;
import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "pricing")
public class PricingProperties {

    private static final Logger log = LoggerFactory.getLogger(PricingProperties.class);

    private BigDecimal minimumInvoice = PricingEngine.DEFAULT_MINIMUM_INVOICE;
    private BigDecimal minimumInvoiceCeiling = PricingEngine.DEFAULT_MINIMUM_INVOICE_CEILING;
    private BigDecimal upgradeThreshold = PricingEngine.DEFAULT_UPGRADE_THRESHOLD;

    // Substitute rate card. Empty means the reference table.
    private String tableVersion;
    private List<TierEntry> tiers = new ArrayList<>();

    @PostConstruct
    public void init() {
        if (hasCustomTiers()) {
            log.warn("======================================");
            log.warn("pricing.tiers is set: {} custom tiers replace reference table {}",
                    tiers.size(), ReferenceTierTable.VERSION);
            log.warn("======================================");
        }
        if (upgradeThreshold != null
                && (upgradeThreshold.signum() <= 0 || upgradeThreshold.compareTo(BigDecimal.ONE) > 0)) {
            log.warn("pricing.upgrade-threshold {} is outside (0, 1]", upgradeThreshold);
        }
    }

    public boolean hasCustomTiers() {
        return tiers != null && !tiers.isEmpty();
    }

    public String getEffectiveTableVersion() {
        if (!hasCustomTiers()) {
            return ReferenceTierTable.VERSION;
        }
        return (tableVersion != null && !tableVersion.isBlank()) ? tableVersion.trim() : "custom";
    }

    public List<RateTier> toRateTiers() {
        return tiers.stream()
                .map(t -> t == null ? null : new RateTier(t.getLower(), t.getUpper(), t.getRate()))
                .toList();
    }

    @Data
    public static class TierEntry {
        private long lower;
        private long upper;
        private BigDecimal rate;
    }
}
