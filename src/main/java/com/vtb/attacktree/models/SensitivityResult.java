package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

/**
 * Результат прогона "что если" для одного листа
 */
@Data
@Builder
public class SensitivityResult {
    private String leafId;
    private double multiplier;
    private double baseProbability;
    private double adjustedProbability;
    private double topEventProbability;
    private double expectedLoss;
}
