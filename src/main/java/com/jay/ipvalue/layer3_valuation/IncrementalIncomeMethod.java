package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.Fractions;
import com.jay.ipvalue.model.IncrementalIncomeParameters;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * "With and without": the after-tax operating profit on revenue the segment would lose
 * without the asset. CF_t = revenue_t × erosion × margin × (1 − tax).
 */
@Component
public class IncrementalIncomeMethod extends IncomeApproachMethod {

    @Override
    public ValuationMethodType type() {
        return ValuationMethodType.INCREMENTAL_INCOME;
    }

    public ValuationResult value(List<Double> revenues, AssumptionSet assumptions,
                                 IncrementalIncomeParameters parameters) {
        validate(revenues, assumptions);
        double erosion = Fractions.requirePresent("erosion fraction", parameters.erosionFraction());
        double margin = Fractions.requirePresent("operating margin", parameters.operatingMargin());
        double afterTax = 1 - assumptions.taxRate();

        List<ProjectedCashFlow> flows = revenues.stream()
            .map(revenue -> ProjectedCashFlow.of(revenue, revenue * erosion * margin * afterTax))
            .toList();

        Map<String, Double> echo = new LinkedHashMap<>();
        echo.put("erosion_fraction", erosion);
        echo.put("operating_margin", margin);

        return CashFlowDiscounter.discount(flows, assumptions, true)
            .method(type())
            .parameters(Collections.unmodifiableMap(echo))
            .approximations(List.of("Revenue erosion without the asset is an estimate"))
            .build();
    }
}
