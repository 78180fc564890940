package com.example.earnings.service.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.PeriodKey;
import com.example.earnings.model.decomposition.DerivedRecord;
import com.example.earnings.model.decomposition.MetricValues;
import lombok.Builder;
import lombok.Getter;

/**
 * 한 기간·한 비교 기준의 비교 결과. 기준이 없으면 prior/change/growthPct 가 null.
 */
@Getter
@Builder
public class Comparison {
    private final Horizon horizon;
    private final DerivedRecord record;
    private final PeriodKey priorKey;
    private final MetricValues current;
    private final MetricValues prior;
    private final MetricValues change;
    private final Double growthPct;
    private final Double loanGrowthPct;

    public boolean isComparable() {
        return change != null;
    }
}
