package com.example.earnings.service.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.PeriodKey;
import com.example.earnings.model.decomposition.DerivedRecord;
import com.example.earnings.model.decomposition.MetricValues;
import org.springframework.stereotype.Component;

/**
 * 비교 기준별 기준 기간을 찾아 증감과 성장률을 계산한다.
 * 기준 조회는 리스트 위치가 아니라 기간 키로 한다(누락 분기는 비교 불가로 처리).
 */
@Component
public class PeriodComparator {

    public Comparison compare(PreparedSeries series, DerivedRecord record, Horizon horizon) {
        if (!horizon.appliesTo(series.kind())) {
            throw new IllegalArgumentException(horizon.label() + " does not apply to " + series.kind().code() + " series");
        }
        PeriodKey key = record.getKey();
        PeriodKey priorKey = key.minus(horizon.lag());
        MetricValues current = series.basisAt(key, horizon);
        MetricValues prior = current == null ? null : series.basisAt(priorKey, horizon);

        Comparison.ComparisonBuilder b = Comparison.builder()
                .horizon(horizon)
                .record(record)
                .priorKey(priorKey)
                .current(current);
        if (prior == null) return b.build();

        MetricValues change = MetricValues.difference(current, prior);
        return b.prior(prior)
                .change(change)
                .growthPct(growthPct(change.getPbt(), prior.getPbt()))
                .loanGrowthPct(growthPct(change.getLoan(), prior.getLoan()))
                .build();
    }

    /** change / |base| * 100. base 가 0 이거나 값이 없으면 null */
    static Double growthPct(Double change, Double base) {
        if (change == null || base == null || base == 0.0) return null;
        return change / Math.abs(base) * 100.0;
    }
}
