package com.example.earnings.model.decomposition;

import com.example.earnings.model.PeriodKey;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

/**
 * 한 기간의 보고값 + 파생 지표. PBT = 핵심이익 + 비경상 항등식이 생성 시점에 성립한다.
 */
@Getter
public final class DerivedRecord {

    private final String entity;
    private final PeriodKey key;
    private final MetricValues values;

    private DerivedRecord(String entity, PeriodKey key, MetricValues values) {
        this.entity = entity;
        this.key = key;
        this.values = values;
    }

    /** 필수 지표가 모두 있는 레코드에서만 호출 */
    public static DerivedRecord of(PeriodRecord r, PeriodKey key) {
        Map<Metric, Double> v = new EnumMap<>(Metric.class);
        v.put(Metric.TOI, r.getToi());
        v.put(Metric.PBT, r.getPbt());
        v.put(Metric.NII, r.getNii());
        v.put(Metric.FEE, r.getFee());
        v.put(Metric.OPEX, r.getOpex());
        v.put(Metric.PROVISION, r.getProvision());
        v.put(Metric.LOAN, r.getLoan());
        v.put(Metric.NIM, r.getNim());
        double coreRevenue = r.getNii() + r.getFee();
        double coreProfit = coreRevenue + r.getOpex() + r.getProvision();
        v.put(Metric.CORE_REVENUE, coreRevenue);
        v.put(Metric.CORE_PROFIT, coreProfit);
        v.put(Metric.NON_RECURRING, r.getPbt() - coreProfit);
        return new DerivedRecord(r.getEntity(), key, MetricValues.of(v));
    }
}
