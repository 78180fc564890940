package com.example.earnings.model.decomposition;

/**
 * 추적 지표. 롤링 집계 시 FLOW 는 합계, STOCK/RATIO 는 평균.
 */
public enum Metric {
    TOI(Aggregation.FLOW),
    PBT(Aggregation.FLOW),
    NII(Aggregation.FLOW),
    FEE(Aggregation.FLOW),
    OPEX(Aggregation.FLOW),
    PROVISION(Aggregation.FLOW),
    CORE_REVENUE(Aggregation.FLOW),
    CORE_PROFIT(Aggregation.FLOW),
    NON_RECURRING(Aggregation.FLOW),
    LOAN(Aggregation.STOCK),
    NIM(Aggregation.RATIO);

    public enum Aggregation { FLOW, STOCK, RATIO }

    private final Aggregation aggregation;

    Metric(Aggregation aggregation) {
        this.aggregation = aggregation;
    }

    public Aggregation aggregation() { return aggregation; }

    public boolean isFlow() { return aggregation == Aggregation.FLOW; }
}
