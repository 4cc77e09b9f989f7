package com.jay.ipvalue.layer1_data;

import org.springframework.stereotype.Component;

/**
 * Allocates by revenue share: a segment bringing in 30% of revenue is assumed to carry 30% of
 * gross profit and R&D. An estimate, not a disclosed fact.
 */
@Component
public class ProportionalRevenueAllocation implements SegmentAllocationStrategy {

    @Override
    public double share(double segmentRevenue, double companyRevenue) {
        return companyRevenue > 0 ? segmentRevenue / companyRevenue : 0;
    }
}
