package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.ExcessEarningsParameters;
import com.jay.ipvalue.model.Fractions;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Isolates the earnings left after every contributory asset has been paid its required return:
 * <pre>
 *   OI_t  = revenue_t × margin
 *   CAC_t = Σ proxy(revenue_t) × r_category
 *   CF_t  = (OI_t − CAC_t) × ipContribution × (1 − tax)
 * </pre>
 * Excess earnings may turn negative when charges exceed operating income; that is reported
 * as is rather than floored.
 */
@Component
@RequiredArgsConstructor
public class MultiPeriodExcessEarningsMethod extends IncomeApproachMethod {

    private final ContributoryAssetProxy proxy;

    @Override
    public ValuationMethodType type() {
        return ValuationMethodType.MULTI_PERIOD_EXCESS_EARNINGS;
    }

    /** All components of {@code parameters} must be present. */
    public ValuationResult value(List<Double> revenues, AssumptionSet assumptions,
                                 ExcessEarningsParameters parameters) {
        validate(revenues, assumptions);
        double margin = Fractions.requirePresent("operating margin", parameters.operatingMargin());
        double ipContribution = Fractions.requirePresent("IP contribution fraction", parameters.ipContributionFraction());
        Map<String, Double> returns = parameters.contributoryAssetReturns();
        if (returns == null) {
            throw new ParameterOutOfRangeException("contributory asset returns are required but were not supplied");
        }
        double combinedReturn = returns.values().stream().mapToDouble(Double::doubleValue).sum();
        double afterTax = 1 - assumptions.taxRate();

        List<ProjectedCashFlow> flows = new ArrayList<>(revenues.size());
        for (double revenue : revenues) {
            double operatingIncome = revenue * margin;
            double charge = proxy.assetValue(revenue) * combinedReturn;
            double cashFlow = (operatingIncome - charge) * ipContribution * afterTax;
            flows.add(new ProjectedCashFlow(revenue, cashFlow, operatingIncome, charge, null));
        }

        Map<String, Double> echo = new LinkedHashMap<>();
        echo.put("operating_margin", margin);
        echo.put("ip_contribution_fraction", ipContribution);
        returns.forEach((category, rate) -> echo.put("return_" + category, rate));

        return CashFlowDiscounter.discount(flows, assumptions, true)
            .method(type())
            .parameters(Collections.unmodifiableMap(echo))
            .approximations(List.of(proxy.describe()))
            .build();
    }
}
