package com.example.earnings.service.decomposition;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.PeriodKey;
import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.DerivedRecord;
import com.example.earnings.model.decomposition.MetricValues;
import com.example.earnings.model.decomposition.RollingAggregate;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 한 엔티티·한 주기의 준비된 시계열. 파생 레코드와 롤링 집계를 기간 키로 조회한다.
 */
public final class PreparedSeries {

    private final String entity;
    private final PeriodKind kind;
    private final List<DerivedRecord> records;
    private final Map<PeriodKey, DerivedRecord> byKey;
    private final Map<PeriodKey, RollingAggregate> rolling;
    private final int skipped;

    PreparedSeries(String entity, PeriodKind kind, List<DerivedRecord> records,
                   Map<PeriodKey, DerivedRecord> byKey, Map<PeriodKey, RollingAggregate> rolling, int skipped) {
        this.entity = entity;
        this.kind = kind;
        this.records = Collections.unmodifiableList(records);
        this.byKey = Collections.unmodifiableMap(byKey);
        this.rolling = Collections.unmodifiableMap(rolling);
        this.skipped = skipped;
    }

    public String entity() { return entity; }

    public PeriodKind kind() { return kind; }

    /** 기간 오름차순 파생 레코드 */
    public List<DerivedRecord> records() { return records; }

    /** 필수 지표 누락으로 제외된 레코드 수 */
    public int skipped() { return skipped; }

    public DerivedRecord derivedAt(PeriodKey key) {
        return key == null ? null : byKey.get(key);
    }

    public RollingAggregate rollingAt(PeriodKey key) {
        return key == null ? null : rolling.get(key);
    }

    public Map<PeriodKey, RollingAggregate> rollingIndex() { return rolling; }

    /** horizon 이 비교에 사용하는 값. 없으면 null */
    public MetricValues basisAt(PeriodKey key, Horizon horizon) {
        if (horizon.rolling()) {
            RollingAggregate agg = rollingAt(key);
            return agg == null ? null : agg.getValues();
        }
        DerivedRecord d = derivedAt(key);
        return d == null ? null : d.getValues();
    }
}
