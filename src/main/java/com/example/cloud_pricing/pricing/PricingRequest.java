package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class PricingRequest {

    @NotNull(message = "spend is required")
    @DecimalMin(value = "0", message = "spend must not be negative")
    private BigDecimal spend; // monthly cloud spend ($)

    @DecimalMin(value = "0", message = "commitAmount must not be negative")
    private BigDecimal commitAmount; // null = no commitment (flex)
}
