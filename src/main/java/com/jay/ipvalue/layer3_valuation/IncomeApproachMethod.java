package com.jay.ipvalue.layer3_valuation;

import com.jay.ipvalue.exception.InsufficientDataException;
import com.jay.ipvalue.exception.ParameterOutOfRangeException;
import com.jay.ipvalue.model.AssumptionSet;
import com.jay.ipvalue.model.Fractions;
import com.jay.ipvalue.model.enums.ValuationMethodType;

import java.util.List;
import java.util.Objects;

/**
 * Common base of the four income-approach methods. Subclasses turn an attributed revenue
 * series into cash flows; discounting and input checks live here.
 * Implementations are stateless and never modify the series they are given.
 */
public abstract class IncomeApproachMethod {

    public abstract ValuationMethodType type();

    /** Empty series, negative or non-finite revenue and an out-of-range tax rate are rejected. */
    protected static void validate(List<Double> revenues, AssumptionSet assumptions) {
        Objects.requireNonNull(assumptions, "assumptions");
        if (revenues == null || revenues.isEmpty()) {
            throw new InsufficientDataException("Revenue series is empty");
        }
        for (int i = 0; i < revenues.size(); i++) {
            Double revenue = revenues.get(i);
            if (revenue == null || !Double.isFinite(revenue) || revenue < 0) {
                throw new ParameterOutOfRangeException(String.format(
                    "Revenue of period %d must be a non-negative number but was %s", i + 1, revenue));
            }
        }
        Fractions.requireFraction("tax rate", assumptions.taxRate());
        assumptions.requireTerminalValueDefined();
    }
}
