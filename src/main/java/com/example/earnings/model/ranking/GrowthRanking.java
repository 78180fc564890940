package com.example.earnings.model.ranking;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Getter;
import lombok.Setter;

import java.util.List;

@Getter
@Setter
@Schema(description = "PBT 성장률 상/하위 랭킹")
public class GrowthRanking {
    @Schema(description = "평가 기간")
    private String period;
    @Schema(description = "순위 산정 대상 엔티티 수(최소 규모 필터 전)")
    private int ranked;
    @Schema(description = "성장 상위")
    private List<RankedEntity> best;
    @Schema(description = "성장 하위")
    private List<RankedEntity> worst;
}
