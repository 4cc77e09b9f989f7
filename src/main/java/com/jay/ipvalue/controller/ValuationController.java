package com.jay.ipvalue.controller;

import com.jay.ipvalue.engine.IpValuationService;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssetValuation;
import com.jay.ipvalue.model.AssumptionDerivation;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.FinancialHealthReport;
import com.jay.ipvalue.model.PortfolioValuation;
import com.jay.ipvalue.model.SensitivityReport;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API: IP valuation.
 *
 * Endpoints:
 *   GET  /api/assumptions/{ticker}          derived WACC, tax rate and terminal growth
 *   GET  /api/health/{ticker}               financial health report
 *   POST /api/value/{ticker}/asset          one asset
 *   POST /api/value/{ticker}/portfolio      several assets, FAIL_FAST or BEST_EFFORT
 *   POST /api/value/{ticker}/compare        one asset under all four methods
 *   POST /api/value/{ticker}/sensitivity    one asset with each driver shifted
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ValuationController {

    private final IpValuationService valuationService;

    @GetMapping("/assumptions/{ticker}")
    public ResponseEntity<AssumptionDerivation> assumptions(
            @PathVariable String ticker,
            @RequestParam(required = false) Double fallbackTaxRate) {
        return ResponseEntity.ok(valuationService.deriveAssumptions(ticker, fallbackTaxRate));
    }

    @GetMapping("/health/{ticker}")
    public ResponseEntity<FinancialHealthReport> health(@PathVariable String ticker) {
        return ResponseEntity.ok(valuationService.analyzeFinancialHealth(ticker));
    }

    @PostMapping("/value/{ticker}/asset")
    public ResponseEntity<AssetValuation> valueAsset(@PathVariable String ticker,
                                                     @RequestBody ValuationRequest.Asset request) {
        requireAsset(request);
        return ResponseEntity.ok(valuationService.valueAsset(
            ticker, request.asset(), assumptions(ticker, request.assumptions())));
    }

    @PostMapping("/value/{ticker}/portfolio")
    public ResponseEntity<PortfolioValuation> valuePortfolio(@PathVariable String ticker,
                                                             @RequestBody ValuationRequest.Portfolio request) {
        if (request.assets() == null || request.assets().isEmpty()) {
            throw new ParameterOutOfRangeException("portfolio must contain at least one asset");
        }
        AssumptionSet assumptions = assumptions(ticker, request.assumptions());
        PortfolioValuation valuation = request.mode() == null
            ? valuationService.valuePortfolio(ticker, request.assets(), assumptions)
            : valuationService.valuePortfolio(ticker, request.assets(), assumptions, request.mode());
        return ResponseEntity.ok(valuation);
    }

    @PostMapping("/value/{ticker}/compare")
    public ResponseEntity<Map<ValuationMethodType, AssetValuation>> compare(
            @PathVariable String ticker, @RequestBody ValuationRequest.Asset request) {
        requireAsset(request);
        return ResponseEntity.ok(valuationService.compareMethods(
            ticker, request.asset(), assumptions(ticker, request.assumptions())));
    }

    @PostMapping("/value/{ticker}/sensitivity")
    public ResponseEntity<SensitivityReport> sensitivity(@PathVariable String ticker,
                                                         @RequestBody ValuationRequest.Asset request) {
        requireAsset(request);
        return ResponseEntity.ok(valuationService.analyzeSensitivity(
            ticker, request.asset(), assumptions(ticker, request.assumptions())));
    }

    private AssumptionSet assumptions(String ticker, AssumptionSet supplied) {
        return supplied != null ? supplied : valuationService.deriveAssumptions(ticker).getAssumptions();
    }

    private static void requireAsset(ValuationRequest.Asset request) {
        if (request.asset() == null) {
            throw new ParameterOutOfRangeException("request must contain an asset");
        }
    }
}
