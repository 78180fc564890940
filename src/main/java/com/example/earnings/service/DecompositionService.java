package com.example.earnings.service;

import com.example.earnings.exception.InvalidSeriesException;
import com.example.earnings.model.PeriodKind;
import com.example.earnings.model.decomposition.DecompositionRow;
import com.example.earnings.model.decomposition.PeriodRecord;
import com.example.earnings.service.decomposition.EntityDecomposer;
import com.example.earnings.service.decomposition.EntitySeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 엔티티별 분해 실행기. 엔티티 간 의존이 없으므로 병렬 스케줄러에서 독립 처리하고,
 * 출력 순서는 입력에서 각 엔티티가 처음 등장한 순서를 따른다.
 */
@Service
public class DecompositionService {

    private static final Logger log = LoggerFactory.getLogger(DecompositionService.class);

    private final EntityDecomposer decomposer;

    public DecompositionService(EntityDecomposer decomposer) {
        this.decomposer = decomposer;
    }

    /**
     * @param records 엔티티별로 기간 오름차순 정렬된 입력(엔티티 간 순서는 무관)
     * @param period  평가 기간 라벨. 지정하면 해당 기간 행만 반환
     */
    public Mono<List<DecompositionRow>> decompose(List<PeriodRecord> records, String period) {
        if (records == null || records.isEmpty()) return Mono.just(List.of());
        String evaluation = period == null || period.isBlank() ? null : period.trim().toUpperCase();
        return Flux.fromIterable(group(records))
                .flatMapSequential(series -> Mono.fromCallable(() -> decomposer.decompose(series))
                        .subscribeOn(Schedulers.parallel())
                        .onErrorResume(e -> {
                            if (e instanceof InvalidSeriesException) {
                                log.warn("Entity {} rejected: {}", series, e.getMessage());
                            } else {
                                log.error("Entity {} failed", series, e);
                            }
                            return Mono.empty();
                        }))
                .flatMapIterable(rows -> rows)
                .filter(row -> evaluation == null || evaluation.equals(row.getPeriod()))
                .collectList();
    }

    /** (엔티티, 주기) 단위로 묶는다. 식별자/주기/기간이 비어 있는 레코드는 버린다 */
    static List<EntitySeries> group(List<PeriodRecord> records) {
        Map<String, List<PeriodRecord>> grouped = new LinkedHashMap<>();
        Map<String, PeriodRecord> heads = new LinkedHashMap<>();
        int dropped = 0;
        for (PeriodRecord r : records) {
            if (r == null || r.getEntity() == null || r.getEntity().isBlank()
                    || r.getKind() == null || r.getPeriod() == null || r.getPeriod().isBlank()) {
                dropped++;
                continue;
            }
            String key = r.getEntity().trim() + "|" + r.getKind().code();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(r);
            heads.putIfAbsent(key, r);
        }
        if (dropped > 0) log.warn("{} records dropped: missing entity, kind or period", dropped);
        List<EntitySeries> out = new ArrayList<>(grouped.size());
        for (Map.Entry<String, List<PeriodRecord>> e : grouped.entrySet()) {
            PeriodRecord head = heads.get(e.getKey());
            PeriodKind kind = head.getKind();
            out.add(new EntitySeries(head.getEntity().trim(), kind, e.getValue()));
        }
        return out;
    }
}
