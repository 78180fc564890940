package com.example.earnings.model.ranking;

import com.example.earnings.model.PeriodKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
@Schema(description = "성장률 랭킹 항목")
public class RankedEntity {
    @Schema(description = "엔티티 식별자")
    private String entity;
    @Schema(description = "주기")
    private PeriodKind kind;
    @Schema(description = "해당 기간 PBT")
    private Double pbt;
    @Schema(description = "직전 기간 대비 PBT 성장률(%)")
    private Double qoqGrowthPct;
    @Schema(description = "전년 동기 대비 PBT 성장률(%)")
    private Double yoyGrowthPct;
    @Schema(description = "QoQ 백분위 순위(작을수록 상위)")
    private Double qoqRank;
    @Schema(description = "YoY 백분위 순위(작을수록 상위)")
    private Double yoyRank;
    @Schema(description = "가용 백분위 순위 평균")
    private Double combinedScore;
}
