package com.example.earnings.model.decomposition;

import com.example.earnings.model.PeriodKind;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 엔티티(은행/티어/섹터) 한 기간의 원천 지표 입력.
 * 비용 항목(opex, provision)은 음수 부호로 들어온다.
 */
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@Schema(description = "기간별 원천 지표 입력")
public class PeriodRecord {
    @Schema(description = "엔티티 식별자(은행 티커 또는 집계 그룹명)", example = "VCB")
    private String entity;
    @Schema(description = "주기: quarterly/annual", example = "quarterly")
    private PeriodKind kind;
    @Schema(description = "기간 라벨. 분기 2024Q3, 연간 2024", example = "2024Q3")
    private String period;

    @Schema(description = "총영업수익(TOI)")
    private Double toi;
    @Schema(description = "세전이익(PBT)")
    private Double pbt;
    @Schema(description = "순이자이익(NII)")
    private Double nii;
    @Schema(description = "수수료이익")
    private Double fee;
    @Schema(description = "영업비용(음수)")
    private Double opex;
    @Schema(description = "충당금 비용(음수)")
    private Double provision;
    @Schema(description = "대출잔액(기말)")
    private Double loan;
    @Schema(description = "순이자마진(%)")
    private Double nim;

    public PeriodRecord(String entity, PeriodKind kind, String period) {
        this.entity = entity;
        this.kind = kind;
        this.period = period;
    }

    /** 필수 지표(TOI, PBT, NII, 수수료, 영업비용, 충당금)가 모두 있는지 */
    public boolean hasRequiredMetrics() {
        return toi != null && pbt != null && nii != null && fee != null && opex != null && provision != null;
    }
}
