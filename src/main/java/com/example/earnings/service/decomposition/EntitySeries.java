package com.example.earnings.service.decomposition;

import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.PeriodRecord;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

/**
 * 한 엔티티·한 주기의 입력 시계열. 내용 기반 equals 로 캐시 키로 쓰인다.
 */
@Getter
@EqualsAndHashCode
public final class EntitySeries {

    private final String entity;
    private final PeriodKind kind;
    private final List<PeriodRecord> records;

    public EntitySeries(String entity, PeriodKind kind, List<PeriodRecord> records) {
        this.entity = entity;
        this.kind = kind;
        this.records = List.copyOf(records);
    }

    @Override
    public String toString() {
        return entity + "/" + (kind == null ? "?" : kind.code()) + "(" + records.size() + ")";
    }
}
