package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import com.salesBoard.biAgent.resilience.normalizer.Vocabularies;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stage weights and health thresholds used by the analyzers.
 * 
 * Every value has an in-code default, so a bare {@code new AnalysisSettings()} behaves like
 * the shipped configuration.
 */
@Slf4j
@Getter
@Setter
@Component
public class AnalysisSettings {

    private static final Map<String, BigDecimal> DEFAULT_STAGE_WEIGHTS = defaultStageWeights();

    @Value("${bi.health.strong-win-rate:0.40}")
    private double strongWinRate = 0.40;

    @Value("${bi.health.weak-win-rate:0.20}")
    private double weakWinRate = 0.20;

    @Value("${bi.health.weighted-pipeline-floor:500000}")
    private BigDecimal weightedPipelineFloor = new BigDecimal("500000");

    @Value("${bi.health.on-hold-ratio-ceiling:0.20}")
    private double onHoldRatioCeiling = 0.20;

    @Value("${bi.health.late-stage-deal-count:3}")
    private int lateStageDealCount = 3;

    @Setter(lombok.AccessLevel.NONE)
    private Map<String, BigDecimal> stageWeights = DEFAULT_STAGE_WEIGHTS;

    /**
     * Overrides stage weights from a {@code Stage=weight} list separated by commas.
     * Stages that are not listed keep their default weight.
     *
     * @throws IllegalArgumentException on an unknown stage or a weight outside [0, 1]
     */
    @Value("${bi.pipeline.stage-weights:}")
    public void setStageWeights(String weights) {
        if (weights == null || weights.isBlank()) {
            return;
        }
        Map<String, BigDecimal> merged = new LinkedHashMap<>(DEFAULT_STAGE_WEIGHTS);
        for (String entry : weights.split(",")) {
            String[] parts = entry.split("=");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Malformed stage weight entry: '" + entry.trim() + "'");
            }
            String stage = Vocabularies.DEAL_STAGES.lookup(parts[0])
                    .orElseThrow(() -> new IllegalArgumentException("Unknown stage in weights: '" + parts[0].trim() + "'"));
            BigDecimal weight = new BigDecimal(parts[1].trim());
            if (weight.signum() < 0 || weight.compareTo(BigDecimal.ONE) > 0) {
                throw new IllegalArgumentException("Stage weight for " + stage + " must be within [0, 1]: " + weight);
            }
            merged.put(stage, weight);
        }
        this.stageWeights = Collections.unmodifiableMap(merged);
        log.debug("Stage weights configured: {}", stageWeights);
    }

    /**
     * Weight of a deal stage; unmapped stages weigh nothing.
     */
    public BigDecimal weightFor(CategoryMatch stage) {
        if (stage == null || !stage.isMapped()) {
            return BigDecimal.ZERO;
        }
        return stageWeights.getOrDefault(stage.label(), BigDecimal.ZERO);
    }

    private static Map<String, BigDecimal> defaultStageWeights() {
        Map<String, BigDecimal> weights = new LinkedHashMap<>();
        weights.put(Vocabularies.LEAD, new BigDecimal("0.10"));
        weights.put(Vocabularies.QUALIFIED, new BigDecimal("0.25"));
        weights.put(Vocabularies.PROPOSAL, new BigDecimal("0.50"));
        weights.put(Vocabularies.NEGOTIATION, new BigDecimal("0.75"));
        weights.put(Vocabularies.CLOSED_WON, new BigDecimal("1.00"));
        weights.put(Vocabularies.CLOSED_LOST, BigDecimal.ZERO);
        return Collections.unmodifiableMap(weights);
    }
}
