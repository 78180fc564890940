package com.example.earnings.service.decomposition;

import com.example.earnings.config.AttributionSettings;
import com.example.earnings.model.decomposition.AttributionScores;
import com.example.earnings.model.decomposition.ControlFlags;
import com.example.earnings.model.decomposition.MetricValues;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 증감 벡터를 점수(%p)로 정규화하고 성장률 기여 임팩트로 환산한다.
 *
 * <p>ΔPBT = Δ핵심수익 + Δ영업비용 + Δ충당금 + Δ비경상 이므로 하한/캡이 걸리지 않으면
 * 탑라인+비용+비경상 점수 합은 ±100, 임팩트 합은 성장률과 같다.
 */
@Component
public class EarningsAttributor {

    private final AttributionSettings settings;

    public EarningsAttributor(AttributionSettings settings) {
        this.settings = settings;
    }

    public Attribution attribute(Comparison c) {
        if (c == null || !c.isComparable()) return Attribution.empty();
        MetricValues d = c.getChange();

        double absChange = Math.abs(d.getPbt());
        double denom = Math.max(absChange, settings.getFloor());
        boolean smallDenominator = absChange < settings.getFloor();

        double nii = score(d.getNii(), denom);
        Double loan = null;
        Double margin = null;
        if (c.getLoanGrowthPct() != null) {
            // 대출 성장 기여는 근사치, 마진은 잔차로 NII 점수를 정확히 맞춘다
            loan = c.getLoanGrowthPct() / 2.0;
            margin = nii - loan;
        }
        AttributionScores raw = AttributionScores.builder()
                .topLine(score(d.getCoreRevenue(), denom))
                .cost(score(d.getOpex() + d.getProvision(), denom))
                .nonRecurring(score(d.getNonRecurring(), denom))
                .nii(nii)
                .fee(score(d.getFee(), denom))
                .opex(score(d.getOpex(), denom))
                .provision(score(d.getProvision(), denom))
                .loan(loan)
                .margin(margin)
                .build();

        double cap = settings.getCap();
        AttributionScores capped = raw.map(v -> Math.max(-cap, Math.min(cap, v)));

        Double growth = c.getGrowthPct();
        AttributionScores impacts = null;
        Double total = null;
        Double discrepancy = null;
        boolean inconsistent = false;
        if (growth != null) {
            double scale = Math.abs(growth) / 100.0;
            impacts = capped.map(v -> v * scale);
            total = impacts.getTopLine() + impacts.getCost() + impacts.getNonRecurring();
            discrepancy = total - growth;
            inconsistent = Math.abs(discrepancy) > settings.getTolerance() * Math.max(1.0, Math.abs(growth));
        }
        ControlFlags flags = new ControlFlags(smallDenominator, !Objects.equals(raw, capped), inconsistent);

        return Attribution.builder()
                .denominator(denom)
                .rawScores(raw)
                .scores(capped)
                .impacts(impacts)
                .totalImpact(total)
                .impactDiscrepancy(discrepancy)
                .flags(flags)
                .build();
    }

    private static double score(double change, double denom) {
        return change / denom * 100.0;
    }
}
