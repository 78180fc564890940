package com.example.earnings.service.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.PeriodKey;
import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.DerivedRecord;
import com.example.earnings.model.decomposition.PeriodRecord;
import com.example.earnings.support.TestRecords;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodComparatorTest {

    private final SeriesPreparer preparer = new SeriesPreparer();
    private final PeriodComparator comparator = new PeriodComparator();

    @Test
    @DisplayName("이력 게이팅: QoQ 는 2번째, YoY 는 5번째 분기부터. T12M 은 4분기 전에도 롤링 집계가 있어야 하므로 5번째가 아닌 8번째 분기부터 비교 가능")
    void historyGatingTrailingTwelveMonthsStartsAtEighthQuarter() {
        // 지표 크기와 무관해야 하므로 큰 증가폭 사용
        PreparedSeries s = preparer.prepare("X", PeriodKind.QUARTERLY, TestRecords.steadyQuarters("X", 10, 1_000_000));
        List<DerivedRecord> records = s.records();
        for (int i = 0; i < records.size(); i++) {
            int position = i + 1;
            DerivedRecord d = records.get(i);
            assertEquals(position >= 2, comparator.compare(s, d, Horizon.QOQ).isComparable(), "QoQ @" + position);
            assertEquals(position >= 5, comparator.compare(s, d, Horizon.YOY).isComparable(), "YoY @" + position);
            // 5~7번째 분기는 현재 롤링 집계는 있지만 비교할 이전 집계가 없다
            assertEquals(position >= 8, comparator.compare(s, d, Horizon.T12M).isComparable(), "T12M @" + position);
        }
    }

    @Test
    @DisplayName("QoQ: 직전 분기 대비 증감과 성장률")
    void quarterOverQuarter() {
        PreparedSeries s = preparer.prepare("X", PeriodKind.QUARTERLY, List.of(
                TestRecords.quarter("X", "2024Q1", 100, 150, 50, -80, -30, 1000.0),
                TestRecords.quarter("X", "2024Q2", 120, 162, 54, -76, -28, 1050.0)));

        Comparison c = comparator.compare(s, s.derivedAt(PeriodKey.quarter(2024, 2)), Horizon.QOQ);

        assertTrue(c.isComparable());
        assertEquals(PeriodKey.quarter(2024, 1), c.getPriorKey());
        assertEquals(20.0, c.getChange().getPbt(), 1e-9);
        assertEquals(16.0, c.getChange().getCoreRevenue(), 1e-9);
        assertEquals(-2.0, c.getChange().getNonRecurring(), 1e-9);
        assertEquals(20.0, c.getGrowthPct(), 1e-9);
        assertEquals(5.0, c.getLoanGrowthPct(), 1e-9);
    }

    @Test
    @DisplayName("YoY: 1년 전 같은 분기, T12M: 4분기 전 롤링 집계와 비교")
    void yearOverYearAndTrailing() {
        PreparedSeries s = preparer.prepare("X", PeriodKind.QUARTERLY, TestRecords.steadyQuarters("X", 8, 10));
        DerivedRecord last = s.derivedAt(PeriodKey.quarter(2024, 4));

        Comparison yoy = comparator.compare(s, last, Horizon.YOY);
        assertEquals(PeriodKey.quarter(2023, 4), yoy.getPriorKey());
        // PBT 170 vs 130
        assertEquals(40.0, yoy.getChange().getPbt(), 1e-9);

        Comparison t12m = comparator.compare(s, last, Horizon.T12M);
        // (140+150+160+170) - (100+110+120+130)
        assertEquals(620.0, t12m.getCurrent().getPbt(), 1e-9);
        assertEquals(460.0, t12m.getPrior().getPbt(), 1e-9);
        assertEquals(160.0, t12m.getChange().getPbt(), 1e-9);
        assertEquals(160.0 / 460.0 * 100.0, t12m.getGrowthPct(), 1e-9);
    }

    @Test
    @DisplayName("기준 분기가 누락되면 위치가 아니라 키로 찾으므로 비교 불가")
    void gapFailsClosed() {
        PreparedSeries s = preparer.prepare("X", PeriodKind.QUARTERLY, List.of(
                TestRecords.quarter("X", "2024Q1", 100, 150, 50, -80, -30, 1000.0),
                TestRecords.quarter("X", "2024Q3", 120, 162, 54, -76, -28, 1050.0)));

        Comparison c = comparator.compare(s, s.derivedAt(PeriodKey.quarter(2024, 3)), Horizon.QOQ);

        assertFalse(c.isComparable());
        assertNull(c.getChange());
        assertNull(c.getGrowthPct());
        assertNotNull(c.getCurrent());
    }

    @Test
    @DisplayName("기준 PBT 가 0 이면 성장률 null, 대출 누락 시 대출 성장률 null")
    void zeroBaseGrowthIsNull() {
        PreparedSeries s = preparer.prepare("X", PeriodKind.QUARTERLY, List.of(
                TestRecords.quarter("X", "2024Q1", 0, 150, 50, -80, -30, null),
                TestRecords.quarter("X", "2024Q2", 20, 162, 54, -76, -28, 1050.0)));

        Comparison c = comparator.compare(s, s.derivedAt(PeriodKey.quarter(2024, 2)), Horizon.QOQ);

        assertTrue(c.isComparable());
        assertNull(c.getGrowthPct());
        assertNull(c.getLoanGrowthPct());
    }

    @Test
    @DisplayName("연간: 직전 연도와 비교, 분기 기준은 적용 불가")
    void annualComparison() {
        List<PeriodRecord> records = List.of(
                TestRecords.year("X", "2023", 400, 600, 200, -320, -120, 4000.0),
                TestRecords.year("X", "2024", 500, 700, 200, -300, -100, 4400.0));
        PreparedSeries s = preparer.prepare("X", PeriodKind.ANNUAL, records);

        assertFalse(comparator.compare(s, s.derivedAt(PeriodKey.year(2023)), Horizon.ANNUAL).isComparable());
        Comparison c = comparator.compare(s, s.derivedAt(PeriodKey.year(2024)), Horizon.ANNUAL);
        assertEquals(25.0, c.getGrowthPct(), 1e-9);
        assertEquals(10.0, c.getLoanGrowthPct(), 1e-9);

        assertThrows(IllegalArgumentException.class,
                () -> comparator.compare(s, s.derivedAt(PeriodKey.year(2024)), Horizon.QOQ));
    }
}
