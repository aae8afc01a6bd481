package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.cloud_pricing.dto.BulkPricingRequest;

import lombok.RequiredArgsConstructor;

/**
 * Flex vs commit quote for one spend / commitment pair.
 */
@Component
@RequiredArgsConstructor
public class PricingCalculator {

    private static final Logger log = LoggerFactory.getLogger(PricingCalculator.class);

    private final PricingEngine engine;

    public PricingResponse quote(PricingRequest in) {
        if (in == null) {
            throw new IllegalArgumentException("pricing request is required");
        }
        BigDecimal spend = in.getSpend();
        BigDecimal commitAmount = nz(in.getCommitAmount());

        BigDecimal flex = engine.flexPrice(spend);
        BigDecimal tiered = engine.tieredCost(spend);
        BigDecimal commit = engine.commitPrice(spend, commitAmount);
        long recommended = engine.recommendCommitTier(spend);

        BigDecimal commitRate = commitAmount.signum() == 0
                ? null
                : engine.commitTier(commitAmount).rate();

        // USD: 2桁で丸める (engine values stay exact)
        BigDecimal flexUsd = usd(flex);
        BigDecimal commitUsd = usd(commit);
        BigDecimal savings = flexUsd.subtract(commitUsd);

        log.debug("Quote spend={} commit={} flex={} commitPrice={} recommended={}",
                spend, commitAmount, flexUsd, commitUsd, recommended);

        return PricingResponse.builder()
                .spend(spend)
                .commitAmount(commitAmount)
                .flexPrice(flexUsd)
                .commitPrice(commitUsd)
                .savings(savings)
                .savingsAvailable(savings.signum() > 0)
                .commitRate(commitRate)
                .recommendedCommitAmount(recommended)
                .minimumInvoiceApplied(flex.compareTo(tiered) > 0)
                .tableVersion(engine.getTable().version())
                .build();
    }

    public List<PricingResponse> quoteAll(BulkPricingRequest req) {
        List<PricingResponse> out = req.getScenarios().stream()
                .map(this::quote)
                .toList();
        log.info("Bulk quote: {} scenarios", out.size());
        return out;
    }

    static BigDecimal usd(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }

    private static BigDecimal nz(BigDecimal v) {
        return v == null ? BigDecimal.ZERO : v;
    }
}
