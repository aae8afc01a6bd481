package com.example.cloud_pricing.pricing;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.example.cloud_pricing.dto.BulkPricingRequest;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;

@RestController
@RequestMapping("/pricing")
@RequiredArgsConstructor
@Validated
public class PricingController {

    private final PricingCalculator calculator;
    private final PricingEngine engine;

    @PostMapping("/calc")
    public ResponseEntity<PricingResponse> calc(@Valid @RequestBody PricingRequest req) {
        return ResponseEntity.ok(calculator.quote(req));
    }

    @PostMapping("/calc/bulk")
    public ResponseEntity<List<PricingResponse>> calcBulk(@Valid @RequestBody BulkPricingRequest req) {
        return ResponseEntity.ok(calculator.quoteAll(req));
    }

    @GetMapping("/flex")
    public ResponseEntity<?> flex(@RequestParam BigDecimal spend) {
        BigDecimal price = engine.flexPrice(spend);
        return ResponseEntity.ok(Map.of(
                "spend", spend,
                "price", PricingCalculator.usd(price)));
    }

    @GetMapping("/commit")
    public ResponseEntity<?> commit(
            @RequestParam BigDecimal spend,
            @RequestParam(defaultValue = "0") BigDecimal commitAmount) {
        BigDecimal price = engine.commitPrice(spend, commitAmount);
        return ResponseEntity.ok(Map.of(
                "spend", spend,
                "commitAmount", commitAmount,
                "price", PricingCalculator.usd(price)));
    }

    @GetMapping("/recommendation")
    public ResponseEntity<?> recommendation(@RequestParam BigDecimal spend) {
        long recommended = engine.recommendCommitTier(spend);
        return ResponseEntity.ok(Map.of(
                "spend", spend,
                "recommendedCommitAmount", recommended));
    }

    /**
     * Rate card for display. Read-only.
     */
    @GetMapping("/tiers")
    public ResponseEntity<?> tiers() {
        return ResponseEntity.ok(Map.of(
                "version", engine.getTable().version(),
                "tiers", engine.listTiers()));
    }
}
