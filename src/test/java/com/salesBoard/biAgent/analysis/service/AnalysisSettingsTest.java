package com.salesBoard.biAgent.analysis.service;

import com.salesBoard.biAgent.resilience.model.CategoryMatch;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalysisSettingsTest {

    @Test
    void defaultsWeightEachStage() {
        AnalysisSettings settings = new AnalysisSettings();

        assertThat(settings.weightFor(CategoryMatch.mapped("Lead"))).isEqualByComparingTo("0.10");
        assertThat(settings.weightFor(CategoryMatch.mapped("Negotiation"))).isEqualByComparingTo("0.75");
        assertThat(settings.weightFor(CategoryMatch.mapped("Closed Lost"))).isEqualByComparingTo("0");
        assertThat(settings.weightFor(CategoryMatch.unmapped("On ice"))).isEqualByComparingTo("0");
        assertThat(settings.weightFor(null)).isEqualByComparingTo("0");
    }

    @Test
    void overridesAcceptSynonymsAndKeepOtherDefaults() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setStageWeights(" quoted = 0.6 ,Lead=0.05");

        assertThat(settings.weightFor(CategoryMatch.mapped("Proposal"))).isEqualByComparingTo("0.6");
        assertThat(settings.weightFor(CategoryMatch.mapped("Lead"))).isEqualByComparingTo("0.05");
        assertThat(settings.weightFor(CategoryMatch.mapped("Qualified"))).isEqualByComparingTo("0.25");
    }

    @Test
    void blankOverrideKeepsDefaults() {
        AnalysisSettings settings = new AnalysisSettings();
        settings.setStageWeights("");

        assertThat(settings.getStageWeights()).hasSize(6);
    }

    @Test
    void rejectsInvalidOverrides() {
        AnalysisSettings settings = new AnalysisSettings();

        assertThatThrownBy(() -> settings.setStageWeights("Lead"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Malformed");
        assertThatThrownBy(() -> settings.setStageWeights("Dormant=0.1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown stage");
        assertThatThrownBy(() -> settings.setStageWeights("Lead=1.5"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("within [0, 1]");
    }
}
