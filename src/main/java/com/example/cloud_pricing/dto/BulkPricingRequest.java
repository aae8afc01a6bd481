package com.example.cloud_pricing.dto;

import java.util.List;

import com.example.cloud_pricing.pricing.PricingRequest;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class BulkPricingRequest {
    @NotEmpty(message = "scenarios cannot be empty")
    @Size(max = 100, message = "at most 100 scenarios per request")
    private List<@NotNull @Valid PricingRequest> scenarios;
}
