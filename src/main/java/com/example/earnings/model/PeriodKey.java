package com.example.earnings.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 기간 끝 표식. 분기는 {@code 2024Q3}, 연간은 {@code 2024} 형식.
 * 같은 주기 안에서는 {@link #sequence()} 로 전순서가 정해진다.
 */
@Getter
@EqualsAndHashCode
public final class PeriodKey implements Comparable<PeriodKey> {

    private static final Pattern QUARTER = Pattern.compile("(\\d{4})Q([1-4])");
    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final int MIN_YEAR = 1900;

    private final PeriodKind kind;
    private final int year;
    /** 1..4, 연간은 0 */
    private final int quarter;

    private PeriodKey(PeriodKind kind, int year, int quarter) {
        this.kind = kind;
        this.year = year;
        this.quarter = quarter;
    }

    public static PeriodKey quarter(int year, int quarter) {
        if (quarter < 1 || quarter > 4) throw new IllegalArgumentException("Invalid quarter index: " + quarter);
        return new PeriodKey(PeriodKind.QUARTERLY, year, quarter);
    }

    public static PeriodKey year(int year) {
        return new PeriodKey(PeriodKind.ANNUAL, year, 0);
    }

    /**
     * 라벨을 주기에 맞게 파싱한다.
     *
     * @throws IllegalArgumentException 형식이 주기와 맞지 않는 경우
     */
    public static PeriodKey parse(PeriodKind kind, String label) {
        if (kind == null) throw new IllegalArgumentException("Period kind is required");
        String s = label == null ? "" : label.trim().toUpperCase();
        if (kind == PeriodKind.QUARTERLY) {
            Matcher m = QUARTER.matcher(s);
            if (!m.matches()) throw new IllegalArgumentException("Invalid quarter format: " + label);
            return quarter(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }
        if (!YEAR.matcher(s).matches()) throw new IllegalArgumentException("Invalid year format: " + label);
        return year(Integer.parseInt(s));
    }

    public int sequence() {
        return kind == PeriodKind.QUARTERLY ? year * 4 + (quarter - 1) : year;
    }

    /** lag 단계 이전 기간. 1900년 이전으로 넘어가면 null */
    public PeriodKey minus(int lag) {
        if (kind == PeriodKind.ANNUAL) {
            int y = year - lag;
            return y < MIN_YEAR ? null : year(y);
        }
        int seq = sequence() - lag;
        int y = Math.floorDiv(seq, 4);
        if (y < MIN_YEAR) return null;
        return quarter(y, Math.floorMod(seq, 4) + 1);
    }

    public String label() {
        return kind == PeriodKind.QUARTERLY ? year + "Q" + quarter : String.valueOf(year);
    }

    @Override
    public int compareTo(PeriodKey o) {
        if (kind != o.kind) throw new IllegalArgumentException("Cannot compare " + kind + " with " + o.kind);
        return Integer.compare(sequence(), o.sequence());
    }

    @Override
    public String toString() {
        return label();
    }
}
