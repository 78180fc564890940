package com.example.earnings.model.decomposition;

import com.example.earnings.model.PeriodKey;
import lombok.Getter;

/** 연속 4분기 롤링(T12M) 집계. end 는 마지막 분기 */
@Getter
public final class RollingAggregate {

    private final PeriodKey end;
    private final MetricValues values;

    public RollingAggregate(PeriodKey end, MetricValues values) {
        this.end = end;
        this.values = values;
    }
}
