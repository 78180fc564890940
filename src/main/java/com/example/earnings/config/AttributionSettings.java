package com.example.earnings.config;

import lombok.Getter;

/**
 * 어트리뷰션 파라미터. floor 는 ΔPBT 분모 하한(입력 통화 단위, 십억), cap 은 점수 절대값 상한(%p),
 * tolerance 는 임팩트 합 검증 상대 허용오차.
 */
@Getter
public final class AttributionSettings {

    public static final double DEFAULT_FLOOR = 50.0;
    public static final double DEFAULT_CAP = 500.0;
    public static final double DEFAULT_TOLERANCE = 1e-6;

    private final double floor;
    private final double cap;
    private final double tolerance;

    public AttributionSettings(double floor, double cap, double tolerance) {
        if (floor < 0) throw new IllegalArgumentException("floor must be >= 0: " + floor);
        if (cap <= 0) throw new IllegalArgumentException("cap must be > 0: " + cap);
        if (tolerance < 0) throw new IllegalArgumentException("tolerance must be >= 0: " + tolerance);
        this.floor = floor;
        this.cap = cap;
        this.tolerance = tolerance;
    }

    public static AttributionSettings defaults() {
        return new AttributionSettings(DEFAULT_FLOOR, DEFAULT_CAP, DEFAULT_TOLERANCE);
    }
}
