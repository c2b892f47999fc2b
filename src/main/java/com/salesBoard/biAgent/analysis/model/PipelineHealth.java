package com.salesBoard.biAgent.analysis.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineHealth {

    STRONG("Strong"),
    HEALTHY("Healthy"),
    NEEDS_ATTENTION("Needs Attention"),
    NO_DATA("No Data");

    private final String label;

    PipelineHealth(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
