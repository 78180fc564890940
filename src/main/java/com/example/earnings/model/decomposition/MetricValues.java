package com.example.earnings.model.decomposition;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;

/**
 * 불변 지표 값 묶음. 결과 행이 캐시에서 공유되므로 생성 후 바꿀 수 없다.
 */
@Getter
@EqualsAndHashCode
@Schema(description = "지표 값 묶음(보고값/롤링값/기준값/증감 공용). 단위는 입력과 동일(십억)")
public final class MetricValues {
    @Schema(description = "총영업수익(TOI)")
    private final Double toi;
    @Schema(description = "세전이익(PBT)")
    private final Double pbt;
    @Schema(description = "순이자이익(NII)")
    private final Double nii;
    @Schema(description = "수수료이익")
    private final Double fee;
    @Schema(description = "영업비용(음수)")
    private final Double opex;
    @Schema(description = "충당금 비용(음수)")
    private final Double provision;
    @Schema(description = "핵심수익 = NII + 수수료")
    private final Double coreRevenue;
    @Schema(description = "핵심이익 = 핵심수익 + 영업비용 + 충당금")
    private final Double coreProfit;
    @Schema(description = "비경상 = PBT - 핵심이익")
    private final Double nonRecurring;
    @Schema(description = "대출잔액")
    private final Double loan;
    @Schema(description = "순이자마진(NIM)")
    private final Double nim;

    private MetricValues(Map<Metric, Double> v) {
        this.toi = v.get(Metric.TOI);
        this.pbt = v.get(Metric.PBT);
        this.nii = v.get(Metric.NII);
        this.fee = v.get(Metric.FEE);
        this.opex = v.get(Metric.OPEX);
        this.provision = v.get(Metric.PROVISION);
        this.coreRevenue = v.get(Metric.CORE_REVENUE);
        this.coreProfit = v.get(Metric.CORE_PROFIT);
        this.nonRecurring = v.get(Metric.NON_RECURRING);
        this.loan = v.get(Metric.LOAN);
        this.nim = v.get(Metric.NIM);
    }

    /** 없는 지표는 null */
    public static MetricValues of(Map<Metric, Double> values) {
        return new MetricValues(values);
    }

    public Double get(Metric m) {
        switch (m) {
            case TOI: return toi;
            case PBT: return pbt;
            case NII: return nii;
            case FEE: return fee;
            case OPEX: return opex;
            case PROVISION: return provision;
            case CORE_REVENUE: return coreRevenue;
            case CORE_PROFIT: return coreProfit;
            case NON_RECURRING: return nonRecurring;
            case LOAN: return loan;
            case NIM: return nim;
            default: throw new IllegalArgumentException("Unknown metric: " + m);
        }
    }

    /** 모든 지표의 current - prior. 어느 한쪽이 null 이면 해당 지표는 null */
    public static MetricValues difference(MetricValues current, MetricValues prior) {
        Map<Metric, Double> out = new EnumMap<>(Metric.class);
        for (Metric m : Metric.values()) {
            Double c = current.get(m);
            Double p = prior.get(m);
            if (c != null && p != null) out.put(m, c - p);
        }
        return new MetricValues(out);
    }
}
