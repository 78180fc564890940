package com.example.earnings.service.decomposition;

import com.example.earnings.model.decomposition.AttributionScores;
import com.example.earnings.model.decomposition.ControlFlags;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class Attribution {
    private final Double denominator;
    private final AttributionScores rawScores;
    private final AttributionScores scores;
    private final AttributionScores impacts;
    private final Double totalImpact;
    private final Double impactDiscrepancy;
    private final ControlFlags flags;

    static Attribution empty() {
        return Attribution.builder().flags(ControlFlags.NONE).build();
    }
}
