package com.example.earnings.service.decomposition;

import com.example.earnings.exception.InvalidSeriesException;
import com.example.earnings.model.PeriodKey;
import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.DerivedRecord;
import com.example.earnings.model.decomposition.Metric;
import com.example.earnings.model.decomposition.MetricValues;
import com.example.earnings.model.decomposition.PeriodRecord;
import com.example.earnings.model.decomposition.RollingAggregate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 시계열 준비: 파생 지표 계산 + 분기 롤링(T12M) 인덱스 구축.
 */
@Component
public class SeriesPreparer {

    private static final Logger log = LoggerFactory.getLogger(SeriesPreparer.class);

    static final int WINDOW = 4;

    public PreparedSeries prepare(String entity, PeriodKind kind, List<PeriodRecord> input) {
        if (kind == null) throw new InvalidSeriesException(entity, "period kind is required");
        List<DerivedRecord> derived = new ArrayList<>();
        Map<PeriodKey, DerivedRecord> byKey = new HashMap<>();
        PeriodKey last = null;
        int skipped = 0;
        for (PeriodRecord r : input == null ? List.<PeriodRecord>of() : input) {
            if (r.getKind() != null && r.getKind() != kind) {
                throw new InvalidSeriesException(entity, "mixed period kinds: " + r.getKind().code() + " in " + kind.code() + " series");
            }
            PeriodKey key;
            try {
                key = PeriodKey.parse(kind, r.getPeriod());
            } catch (IllegalArgumentException e) {
                throw new InvalidSeriesException(entity, e.getMessage(), e);
            }
            if (last != null && key.sequence() <= last.sequence()) {
                String reason = key.equals(last) ? "duplicate period " : "non-increasing period ";
                throw new InvalidSeriesException(entity, reason + key.label() + " after " + last.label());
            }
            last = key;
            if (!r.hasRequiredMetrics()) {
                skipped++;
                log.debug("{} {}: missing required metric, skipped", entity, key.label());
                continue;
            }
            DerivedRecord d = DerivedRecord.of(r, key);
            derived.add(d);
            byKey.put(key, d);
        }
        Map<PeriodKey, RollingAggregate> rolling = kind == PeriodKind.QUARTERLY ? rollingIndex(derived) : Map.of();
        return new PreparedSeries(entity, kind, derived, byKey, rolling, skipped);
    }

    /** 단일 전진 패스. 분기 연속이 끊기면 창을 비운다 */
    static Map<PeriodKey, RollingAggregate> rollingIndex(List<DerivedRecord> records) {
        Map<PeriodKey, RollingAggregate> out = new LinkedHashMap<>();
        Deque<DerivedRecord> window = new ArrayDeque<>(WINDOW);
        for (DerivedRecord d : records) {
            DerivedRecord prev = window.peekLast();
            if (prev != null && prev.getKey().sequence() + 1 != d.getKey().sequence()) {
                window.clear();
            }
            window.addLast(d);
            if (window.size() > WINDOW) window.removeFirst();
            if (window.size() == WINDOW) {
                out.put(d.getKey(), new RollingAggregate(d.getKey(), aggregate(window)));
            }
        }
        return out;
    }

    private static MetricValues aggregate(Iterable<DerivedRecord> window) {
        Map<Metric, Double> out = new EnumMap<>(Metric.class);
        for (Metric m : Metric.values()) {
            double sum = 0.0;
            int n = 0;
            for (DerivedRecord d : window) {
                Double v = d.getValues().get(m);
                if (v == null) continue;
                sum += v;
                n++;
            }
            if (m.isFlow()) {
                if (n == WINDOW) out.put(m, sum);
            } else {
                if (n > 0) out.put(m, sum / n);
            }
        }
        return MetricValues.of(out);
    }
}
