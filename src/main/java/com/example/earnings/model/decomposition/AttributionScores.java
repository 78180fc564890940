package com.example.earnings.model.decomposition;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.function.DoubleUnaryOperator;

/**
 * 구성요소별 점수 또는 임팩트(%p, 부호 포함). 불변.
 * topLine = nii + fee, cost = opex + provision, nii = loan + margin.
 */
@Getter
@Builder
@EqualsAndHashCode
@Schema(description = "구성요소별 점수/임팩트(%p)")
public final class AttributionScores {
    @Schema(description = "핵심수익(탑라인)")
    private final Double topLine;
    @Schema(description = "비용(영업비용+충당금)")
    private final Double cost;
    @Schema(description = "비경상")
    private final Double nonRecurring;
    @Schema(description = "탑라인 중 NII")
    private final Double nii;
    @Schema(description = "탑라인 중 수수료")
    private final Double fee;
    @Schema(description = "비용 중 영업비용")
    private final Double opex;
    @Schema(description = "비용 중 충당금")
    private final Double provision;
    @Schema(description = "NII 중 대출 성장(근사)")
    private final Double loan;
    @Schema(description = "NII 중 마진(잔차)")
    private final Double margin;

    /** null 이 아닌 항목에 op 를 적용한 새 인스턴스 */
    public AttributionScores map(DoubleUnaryOperator op) {
        return AttributionScores.builder()
                .topLine(apply(topLine, op))
                .cost(apply(cost, op))
                .nonRecurring(apply(nonRecurring, op))
                .nii(apply(nii, op))
                .fee(apply(fee, op))
                .opex(apply(opex, op))
                .provision(apply(provision, op))
                .loan(apply(loan, op))
                .margin(apply(margin, op))
                .build();
    }

    private static Double apply(Double v, DoubleUnaryOperator op) {
        return v == null ? null : op.applyAsDouble(v);
    }
}
