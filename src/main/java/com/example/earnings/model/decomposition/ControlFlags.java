package com.example.earnings.model.decomposition;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.EqualsAndHashCode;
import lombok.Getter;

@Getter
@EqualsAndHashCode
@Schema(description = "제어 플래그")
public final class ControlFlags {

    public static final ControlFlags NONE = new ControlFlags(false, false, false);

    @Schema(description = "|ΔPBT| 가 하한 미만이라 분모 하한 적용")
    private final boolean smallDenominator;
    @Schema(description = "점수 중 하나 이상이 상/하한으로 잘림")
    private final boolean capped;
    @Schema(description = "임팩트 합계가 성장률과 허용오차 이상 차이(하한/캡 영향)")
    private final boolean impactInconsistent;

    public ControlFlags(boolean smallDenominator, boolean capped, boolean impactInconsistent) {
        this.smallDenominator = smallDenominator;
        this.capped = capped;
        this.impactInconsistent = impactInconsistent;
    }
}
