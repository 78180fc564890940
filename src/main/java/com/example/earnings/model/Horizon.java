package com.example.earnings.model;

import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.ArrayList;
import java.util.List;

/**
 * 비교 기준. 각 값이 적용 주기, 기준 시점까지의 lag, 롤링(T12M) 값 비교 여부를 가진다.
 * 분기 데이터의 무접미사 비교 그룹은 T12M 으로 본다.
 */
@Schema(description = "비교 기준(T12M/QoQ/YoY/Annual)")
public enum Horizon {
    T12M("T12M", PeriodKind.QUARTERLY, 4, true, ""),
    QOQ("QoQ", PeriodKind.QUARTERLY, 1, false, "_QoQ"),
    YOY("YoY", PeriodKind.QUARTERLY, 4, false, "_YoY"),
    ANNUAL("Annual", PeriodKind.ANNUAL, 1, false, "");

    private final String label;
    private final PeriodKind kind;
    private final int lag;
    private final boolean rolling;
    private final String columnSuffix;

    Horizon(String label, PeriodKind kind, int lag, boolean rolling, String columnSuffix) {
        this.label = label;
        this.kind = kind;
        this.lag = lag;
        this.rolling = rolling;
        this.columnSuffix = columnSuffix;
    }

    @JsonValue
    public String label() { return label; }

    public PeriodKind kind() { return kind; }

    public int lag() { return lag; }

    /** true 면 현재/기준 값 모두 4분기 롤링 집계를 사용 */
    public boolean rolling() { return rolling; }

    public String columnSuffix() { return columnSuffix; }

    public boolean appliesTo(PeriodKind k) { return kind == k; }

    public static List<Horizon> applicableTo(PeriodKind k) {
        List<Horizon> out = new ArrayList<>();
        for (Horizon h : values()) if (h.appliesTo(k)) out.add(h);
        return out;
    }
}
