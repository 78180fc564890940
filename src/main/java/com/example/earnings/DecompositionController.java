package com.example.earnings;

import com.example.earnings.model.decomposition.DecompositionRow;
import com.example.earnings.model.decomposition.PeriodRecord;
import com.example.earnings.model.ranking.GrowthRanking;
import com.example.earnings.service.DecompositionService;
import com.example.earnings.service.GrowthRankingService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@Tag(name = "Decomposition API", description = "PBT 성장의 이익의 질 분해(T12M/QoQ/YoY/Annual)")
@RequiredArgsConstructor
public class DecompositionController {

    private final DecompositionService decompositionService;
    private final GrowthRankingService growthRankingService;

    @PostMapping("/decomposition")
    @Operation(summary = "이익의 질 분해", description = "엔티티별 기간 시계열을 받아 (엔티티, 비교 기준, 기간)별 분해 행을 반환")
    public Mono<List<DecompositionRow>> decompose(
            @Parameter(description = "평가 기간 라벨 예: 2024Q3/2024. 비우면 전체 기간") @RequestParam(required = false) String period,
            @RequestBody List<PeriodRecord> records
    ) {
        return decompositionService.decompose(records, period);
    }

    @PostMapping("/decomposition/ranking")
    @Operation(summary = "PBT 성장 랭킹", description = "QoQ/YoY 성장률 백분위 순위 평균으로 상위/하위 엔티티")
    public Mono<GrowthRanking> ranking(
            @Parameter(description = "평가 기간 라벨 예: 2024Q3") @RequestParam String period,
            @Parameter(description = "상/하위 개수") @RequestParam(defaultValue = "10") int topN,
            @Parameter(description = "최소 |PBT| 규모") @RequestParam(defaultValue = "0") double minBase,
            @RequestBody List<PeriodRecord> records
    ) {
        return growthRankingService.rank(records, period, topN, minBase);
    }
}
