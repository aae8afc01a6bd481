package com.example.cloud_pricing.pricing;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {
        "pricing.table-version=test-2tier",
        "pricing.minimum-invoice=0",
        "pricing.tiers[0].lower=0",
        "pricing.tiers[0].upper=1000",
        "pricing.tiers[0].rate=0.10",
        "pricing.tiers[1].lower=1001",
        "pricing.tiers[1].upper=10000",
        "pricing.tiers[1].rate=0.05"
})
class CustomTierTableContextTest {

    @Autowired
    private PricingEngine engine;

    @Test
    void configuredTiers_areWiredIntoEngine() {
        assertThat(engine.getTable().version()).isEqualTo("test-2tier");
        assertThat(engine.listTiers()).hasSize(2);
        // 1000 * 0.10 + 999 * 0.05 (second tier capacity is 8999)
        assertThat(engine.flexPrice(new BigDecimal("1999"))).isEqualByComparingTo("149.95");
        assertThat(engine.recommendCommitTier(new BigDecimal("900"))).isEqualTo(10_000L);
    }
}
