package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.Fractions;
import com.jay.ipvalue.model.ValuationResult;
import com.jay.ipvalue.model.enums.ValuationMethodType;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Values the royalty the owner is relieved from paying: CF_t = revenue_t × royalty × (1 − tax).
 */
@Component
public class ReliefFromRoyaltyMethod extends IncomeApproachMethod {

    @Override
    public ValuationMethodType type() {
        return ValuationMethodType.RELIEF_FROM_ROYALTY;
    }

    public ValuationResult value(List<Double> revenues, AssumptionSet assumptions, double royaltyRate) {
        validate(revenues, assumptions);
        Fractions.requireFraction("royalty rate", royaltyRate);
        double afterTax = 1 - assumptions.taxRate();

        List<ProjectedCashFlow> flows = revenues.stream()
            .map(revenue -> ProjectedCashFlow.of(revenue, revenue * royaltyRate * afterTax))
            .toList();

        return CashFlowDiscounter.discount(flows, assumptions, true)
            .method(type())
            .parameters(Map.of("royalty_rate", royaltyRate))
            .approximations(List.of())
            .build();
    }
}
