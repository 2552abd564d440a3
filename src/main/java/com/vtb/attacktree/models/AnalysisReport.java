package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

@Data
@Builder
public class AnalysisReport {
    private String source;
    @Builder.Default
    private Instant generatedAt = Instant.now();
    private RiskSummary summary;
    private SensitivityResult sensitivity;
    private boolean sensitivityCommitted;
}
