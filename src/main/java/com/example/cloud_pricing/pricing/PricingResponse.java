package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class PricingResponse {
    BigDecimal spend;
    BigDecimal commitAmount; // 0 when no commitment

    BigDecimal flexPrice;
    BigDecimal commitPrice;
    BigDecimal savings; // flex - commit, negative when the commitment costs more
    boolean savingsAvailable;

    BigDecimal commitRate; // null when no commitment
    long recommendedCommitAmount;
    boolean minimumInvoiceApplied; // flex price raised to the minimum invoice

    String tableVersion;
}
