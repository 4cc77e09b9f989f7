package com.jay.ipvalue.controller;

import com.jay.ipvalue.engine.IpValuationService;
import com.jay.ipvalue.exception.DataNotFoundException;
import com.jay.ipvalue.exception.InvalidAssumptionsException;
import com.jay.ipvalue.model.AssetValuation;
import com.jay.ipvalue.model.AssumptionDerivation;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.IpAsset;
import com.jay.ipvalue.model.PortfolioValuation;
import com.jay.ipvalue.model.enums.PortfolioFailureMode;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ValuationController.class)
class ValuationControllerTest {

    private static final String ASSET_JSON = """
        {
          "asset": {
            "id": "iphone-patents",
            "kind": "PATENT",
            "segments": [ { "segmentName": "IPhone", "attributionFraction": 0.2 } ],
            "royaltyRate": 0.05
          },
          "assumptions": { "wacc": 0.10, "taxRate": 0.21, "terminalGrowth": 0.025 }
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private IpValuationService valuationService;

    @Test
    void returnsDerivedAssumptions() throws Exception {
        when(valuationService.deriveAssumptions("AAPL", null)).thenReturn(AssumptionDerivation.builder()
            .ticker("AAPL")
            .assumptions(new AssumptionSet(0.1018, 0.1834, 0.01))
            .build());

        mockMvc.perform(get("/api/assumptions/AAPL"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.ticker").value("AAPL"))
            .andExpect(jsonPath("$.assumptions.wacc").value(0.1018));
    }

    @Test
    void valuesPostedAssetWithSuppliedAssumptions() throws Exception {
        when(valuationService.valueAsset(eq("AAPL"), any(IpAsset.class), eq(new AssumptionSet(0.10, 0.21, 0.025))))
            .thenReturn(AssetValuation.builder()
                .assetId("iphone-patents")
                .method(ValuationMethodType.RELIEF_FROM_ROYALTY)
                .totalValue(1234.5)
                .segmentValuations(List.of())
                .build());

        mockMvc.perform(post("/api/value/AAPL/asset").contentType(MediaType.APPLICATION_JSON).content(ASSET_JSON))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.assetId").value("iphone-patents"))
            .andExpect(jsonPath("$.totalValue").value(1234.5));
        verify(valuationService, never()).deriveAssumptions("AAPL");
    }

    @Test
    void portfolioWithoutModeUsesConfiguredDefault() throws Exception {
        when(valuationService.valuePortfolio(eq("AAPL"), anyList(), any(AssumptionSet.class)))
            .thenReturn(PortfolioValuation.builder().ticker("AAPL").totalValue(10).assetCount(1)
                .mode(PortfolioFailureMode.FAIL_FAST).assetValuations(List.of()).failures(List.of()).build());

        String body = """
            {
              "assets": [ { "id": "p1", "segments": [ { "segmentName": "Mac", "attributionFraction": 0.1 } ], "royaltyRate": 0.03 } ],
              "assumptions": { "wacc": 0.10, "taxRate": 0.21, "terminalGrowth": 0.025 }
            }
            """;
        mockMvc.perform(post("/api/value/AAPL/portfolio").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.mode").value("FAIL_FAST"));
    }

    @Test
    void unknownTickerIsNotFound() throws Exception {
        when(valuationService.analyzeFinancialHealth("ZZZZ")).thenThrow(new DataNotFoundException("No demo data for ticker 'ZZZZ'"));

        mockMvc.perform(get("/api/health/ZZZZ"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.kind").value("DATA_NOT_FOUND"));
    }

    @Test
    void invalidAssumptionsAreUnprocessable() throws Exception {
        when(valuationService.deriveAssumptions(eq("AAPL"), isNull()))
            .thenThrow(new InvalidAssumptionsException("WACC 0.0200 must exceed terminal growth 0.0300"));

        mockMvc.perform(get("/api/assumptions/AAPL"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("INVALID_ASSUMPTIONS"));
    }

    @Test
    void outOfRangeRoyaltyInBodyIsUnprocessable() throws Exception {
        String body = ASSET_JSON.replace("\"royaltyRate\": 0.05", "\"royaltyRate\": 1.5");

        mockMvc.perform(post("/api/value/AAPL/asset").contentType(MediaType.APPLICATION_JSON).content(body))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.kind").value("PARAMETER_OUT_OF_RANGE"));
    }

    @Test
    void malformedBodyIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/value/AAPL/asset").contentType(MediaType.APPLICATION_JSON).content("{ not json"))
            .andExpect(status().isBadRequest());
    }
}
