package com.jay.ipvalue.layer1_data;

/**
 * Estimates a segment's share of a company-wide metric that is not disclosed per segment
 * (gross profit, R&D, operating income). Swap the implementation once real segment-level
 * disclosures are available; the valuation math does not depend on how the estimate is made.
 */
public interface SegmentAllocationStrategy {

    /** Share of company activity attributed to the segment in one period. */
    double share(double segmentRevenue, double companyRevenue);

    default double allocate(double companyMetric, double segmentRevenue, double companyRevenue) {
        return companyMetric * share(segmentRevenue, companyRevenue);
    }
}
