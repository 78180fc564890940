package com.example.earnings.model.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.PeriodKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Getter;

/**
 * (엔티티, 비교 기준, 기간) 당 한 행. 생성 후 변경하지 않는다.
 * 기준 기간이 없으면 comparable=false 이고 비교 관련 필드는 null.
 */
@Getter
@Builder
@Schema(description = "이익의 질 분해 결과 행")
public class DecompositionRow {
    @Schema(description = "엔티티 식별자")
    private final String entity;
    @Schema(description = "주기")
    private final PeriodKind kind;
    @Schema(description = "비교 기준")
    private final Horizon horizon;
    @Schema(description = "기간 라벨", example = "2024Q3")
    private final String period;
    @Schema(description = "기준(비교 대상) 기간 라벨")
    private final String priorPeriod;
    @Schema(description = "비교 가능 여부(이력 부족 시 false)")
    private final boolean comparable;

    @Schema(description = "해당 기간 보고값 + 파생 지표")
    private final MetricValues reported;
    @Schema(description = "비교에 쓰인 현재 값(T12M 은 롤링 집계)")
    private final MetricValues current;
    @Schema(description = "기준 기간 값")
    private final MetricValues prior;
    @Schema(description = "증감(현재 - 기준)")
    private final MetricValues change;

    @Schema(description = "PBT 성장률(%) = ΔPBT / |기준 PBT| * 100")
    private final Double growthPct;
    @Schema(description = "대출 성장률(%)")
    private final Double loanGrowthPct;

    @Schema(description = "캡 적용 전 점수(%p)")
    private final AttributionScores rawScores;
    @Schema(description = "캡 적용 후 점수(%p)")
    private final AttributionScores scores;
    @Schema(description = "성장률 기여 임팩트(%p)")
    private final AttributionScores impacts;
    @Schema(description = "탑라인+비용+비경상 임팩트 합")
    private final Double totalImpact;
    @Schema(description = "임팩트 합 - 성장률")
    private final Double impactDiscrepancy;

    @Schema(description = "제어 플래그")
    private final ControlFlags flags;

    @Schema(description = "컬럼 접미사(T12M/Annual 은 빈 문자열)")
    public String getColumnSuffix() {
        return horizon == null ? "" : horizon.columnSuffix();
    }
}
