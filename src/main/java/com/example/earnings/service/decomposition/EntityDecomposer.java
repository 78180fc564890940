package com.example.earnings.service.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.decomposition.DecompositionRow;
import com.example.earnings.model.decomposition.DerivedRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 엔티티 한 개의 전체 패스: 준비 → 비교 → 어트리뷰션 → 행 조립.
 * 같은 입력이면 항상 같은 결과이므로 입력 내용으로 캐시한다.
 */
@Component
public class EntityDecomposer {

    private static final Logger log = LoggerFactory.getLogger(EntityDecomposer.class);

    private final SeriesPreparer preparer;
    private final PeriodComparator comparator;
    private final EarningsAttributor attributor;

    public EntityDecomposer(SeriesPreparer preparer, PeriodComparator comparator, EarningsAttributor attributor) {
        this.preparer = preparer;
        this.comparator = comparator;
        this.attributor = attributor;
    }

    @Cacheable(cacheNames = "decomposition", key = "#series")
    public List<DecompositionRow> decompose(EntitySeries series) {
        long started = System.nanoTime();
        PreparedSeries prepared = preparer.prepare(series.getEntity(), series.getKind(), series.getRecords());
        List<Horizon> horizons = Horizon.applicableTo(prepared.kind());
        List<DecompositionRow> rows = new ArrayList<>(prepared.records().size() * horizons.size());
        for (DerivedRecord record : prepared.records()) {
            for (Horizon h : horizons) {
                Comparison c = comparator.compare(prepared, record, h);
                rows.add(toRow(prepared, c, attributor.attribute(c)));
            }
        }
        log.debug("{}: {} rows ({} skipped records) in {} ms", series, rows.size(), prepared.skipped(),
                (System.nanoTime() - started) / 1_000_000);
        return Collections.unmodifiableList(rows);
    }

    private static DecompositionRow toRow(PreparedSeries series, Comparison c, Attribution a) {
        DerivedRecord record = c.getRecord();
        return DecompositionRow.builder()
                .entity(series.entity())
                .kind(series.kind())
                .horizon(c.getHorizon())
                .period(record.getKey().label())
                .priorPeriod(c.isComparable() ? c.getPriorKey().label() : null)
                .comparable(c.isComparable())
                .reported(record.getValues())
                .current(c.getCurrent())
                .prior(c.getPrior())
                .change(c.getChange())
                .growthPct(c.getGrowthPct())
                .loanGrowthPct(c.getLoanGrowthPct())
                .rawScores(a.getRawScores())
                .scores(a.getScores())
                .impacts(a.getImpacts())
                .totalImpact(a.getTotalImpact())
                .impactDiscrepancy(a.getImpactDiscrepancy())
                .flags(a.getFlags())
                .build();
    }
}
