package com.example.earnings.service;

import com.example.earnings.model.Horizon;
import com.example.earnings.model.decomposition.DecompositionRow;
import com.example.earnings.model.decomposition.PeriodRecord;
import com.example.earnings.model.ranking.GrowthRanking;
import com.example.earnings.model.ranking.RankedEntity;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 기간별 PBT 성장 서프라이즈 랭킹. QoQ/YoY 성장률의 내림차순 백분위 순위를 평균해 정렬한다.
 * 연간 엔티티는 Annual 행 하나가 두 비교를 모두 대신한다.
 */
@Service
public class GrowthRankingService {

    private final DecompositionService decompositionService;

    public GrowthRankingService(DecompositionService decompositionService) {
        this.decompositionService = decompositionService;
    }

    public Mono<GrowthRanking> rank(List<PeriodRecord> records, String period, int topN, double minBase) {
        if (period == null || period.isBlank()) return Mono.error(new IllegalArgumentException("period is required"));
        String p = period.trim().toUpperCase();
        return decompositionService.decompose(records, p).map(rows -> rankRows(rows, p, topN, minBase));
    }

    static GrowthRanking rankRows(List<DecompositionRow> rows, String period, int topN, double minBase) {
        Map<String, RankedEntity> byEntity = new LinkedHashMap<>();
        for (DecompositionRow row : rows) {
            if (!period.equals(row.getPeriod())) continue;
            RankedEntity e = byEntity.computeIfAbsent(row.getEntity() + "|" + row.getKind().code(), k -> {
                RankedEntity n = new RankedEntity();
                n.setEntity(row.getEntity());
                n.setKind(row.getKind());
                n.setPbt(row.getReported().getPbt());
                return n;
            });
            Horizon h = row.getHorizon();
            if (h == Horizon.QOQ || h == Horizon.ANNUAL) e.setQoqGrowthPct(row.getGrowthPct());
            if (h == Horizon.YOY || h == Horizon.ANNUAL) e.setYoyGrowthPct(row.getGrowthPct());
        }
        List<RankedEntity> all = new ArrayList<>(byEntity.values());
        assignPercentileRanks(all, RankedEntity::getQoqGrowthPct, RankedEntity::setQoqRank);
        assignPercentileRanks(all, RankedEntity::getYoyGrowthPct, RankedEntity::setYoyRank);
        for (RankedEntity e : all) e.setCombinedScore(mean(e.getQoqRank(), e.getYoyRank()));

        List<RankedEntity> eligible = all.stream()
                .filter(e -> e.getCombinedScore() != null)
                .filter(e -> e.getPbt() != null && Math.abs(e.getPbt()) >= minBase)
                .collect(Collectors.toList());

        Comparator<RankedEntity> byBase = Comparator
                .comparing((RankedEntity e) -> Math.abs(e.getPbt())).reversed()
                .thenComparing(Comparator.comparing(RankedEntity::getPbt).reversed());
        Comparator<RankedEntity> best = Comparator.comparing(RankedEntity::getCombinedScore).thenComparing(byBase);
        Comparator<RankedEntity> worst = Comparator.comparing(RankedEntity::getCombinedScore).reversed().thenComparing(byBase);

        int n = Math.max(0, topN);
        GrowthRanking out = new GrowthRanking();
        out.setPeriod(period);
        out.setRanked(all.size());
        out.setBest(eligible.stream().sorted(best).limit(n).collect(Collectors.toList()));
        out.setWorst(eligible.stream().sorted(worst).limit(n).collect(Collectors.toList()));
        return out;
    }

    /** 값 내림차순 순위/개수. 동점은 평균 순위, 값 없는 항목은 null */
    static void assignPercentileRanks(List<RankedEntity> items,
                                      Function<RankedEntity, Double> value,
                                      BiConsumer<RankedEntity, Double> target) {
        List<Double> sorted = new ArrayList<>();
        for (RankedEntity e : items) if (value.apply(e) != null) sorted.add(value.apply(e));
        sorted.sort(Comparator.reverseOrder());
        int n = sorted.size();
        Map<Double, Double> averageRank = new HashMap<>();
        int i = 0;
        while (i < n) {
            int j = i;
            while (j + 1 < n && sorted.get(j + 1).equals(sorted.get(i))) j++;
            // 1-based 순위 i+1..j+1 의 평균
            averageRank.put(sorted.get(i), ((i + 1) + (j + 1)) / 2.0);
            i = j + 1;
        }
        for (RankedEntity e : items) {
            Double v = value.apply(e);
            target.accept(e, v == null ? null : averageRank.get(v) / n);
        }
    }

    private static Double mean(Double a, Double b) {
        if (a == null) return b;
        if (b == null) return a;
        return (a + b) / 2.0;
    }
}
